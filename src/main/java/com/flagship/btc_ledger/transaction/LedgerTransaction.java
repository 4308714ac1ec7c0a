package com.flagship.btc_ledger.transaction;

import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.lot.HoldingPeriod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;

/**
 * Transaction domain object.
 *
 * Holds the user's inputs plus the roll-up fields (costBasisUsd on disposing
 * transactions, realizedProceedsUsd, realizedGainUsd, holdingPeriod) written
 * back by the replay.
 * A draft built from a command has a null id until it is persisted.
 */
@Value
@Builder(toBuilder = true)
public class LedgerTransaction {

    /**
     * Order in which history is replayed: timestamp, then id to break ties.
     */
    public static final Comparator<LedgerTransaction> REPLAY_ORDER =
        Comparator.comparing(LedgerTransaction::getTimestamp)
            .thenComparing(LedgerTransaction::getId);

    Long id;
    TransactionType type;
    Instant timestamp;
    int fromAccountId;
    int toAccountId;
    BigDecimal amount;
    BigDecimal feeAmount;
    CurrencyCode feeCurrency;
    BigDecimal costBasisUsd;
    BigDecimal proceedsUsd;
    BigDecimal fmvUsd;
    BigDecimal realizedGainUsd;
    BigDecimal realizedProceedsUsd;
    HoldingPeriod holdingPeriod;
    TransactionPurpose purpose;
    TransactionSource source;
    boolean locked;
    Long groupId;
    Instant createdAt;
    Instant updatedAt;

    public boolean hasFee() {
        return feeAmount != null && feeAmount.signum() > 0;
    }

    /**
     * Fee amount if it is charged in the given currency, otherwise zero.
     */
    public BigDecimal feeIn(CurrencyCode currency) {
        return hasFee() && feeCurrency == currency ? feeAmount : BigDecimal.ZERO;
    }

    public BigDecimal costBasisOrZero() {
        return costBasisUsd != null ? costBasisUsd : BigDecimal.ZERO;
    }

    public BigDecimal proceedsOrZero() {
        return proceedsUsd != null ? proceedsUsd : BigDecimal.ZERO;
    }

    public BigDecimal fmvOrZero() {
        return fmvUsd != null ? fmvUsd : BigDecimal.ZERO;
    }

    public TransactionPurpose purposeOrDefault() {
        return purpose != null ? purpose : TransactionPurpose.NA;
    }
}
