package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.lot.HoldingPeriod;
import com.flagship.btc_ledger.lot.LotDisposal;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Roll-up of a transaction's disposals, written back onto the transaction.
 *
 * For a disposing transaction: total basis, total proceeds, total gain, and
 * the holding period of its oldest fragment, so that realized proceeds minus
 * basis is the realized gain. Other transactions carry no outcome fields and
 * keep whatever cost basis the user entered.
 */
@Value
public class TransactionOutcome {
    Long transactionId;
    boolean disposing;
    BigDecimal costBasisUsd;
    BigDecimal realizedProceedsUsd;
    BigDecimal realizedGainUsd;
    HoldingPeriod holdingPeriod;

    public static TransactionOutcome none(Long transactionId) {
        return new TransactionOutcome(transactionId, false, null, null, null, null);
    }

    /**
     * @param fragments the transaction's disposals in FIFO order, not empty
     */
    public static TransactionOutcome rollUp(Long transactionId, List<LotDisposal> fragments) {
        BigDecimal basis = fragments.stream()
            .map(LotDisposal::getDisposalBasisUsd)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal proceeds = fragments.stream()
            .map(LotDisposal::getProceedsUsd)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal gain = fragments.stream()
            .map(LotDisposal::getRealizedGainUsd)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new TransactionOutcome(transactionId, true, basis, proceeds, gain,
            fragments.get(0).getHoldingPeriod());
    }
}
