package com.flagship.btc_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.lot.HoldingPeriod;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionPurpose;
import com.flagship.btc_ledger.transaction.TransactionSource;
import com.flagship.btc_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class TransactionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("from_account_id")
    int fromAccountId;

    @JsonProperty("to_account_id")
    int toAccountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("fee_currency")
    CurrencyCode feeCurrency;

    @JsonProperty("cost_basis_usd")
    BigDecimal costBasisUsd;

    @JsonProperty("proceeds_usd")
    BigDecimal proceedsUsd;

    @JsonProperty("fmv_usd")
    BigDecimal fmvUsd;

    @JsonProperty("realized_gain_usd")
    BigDecimal realizedGainUsd;

    @JsonProperty("realized_proceeds_usd")
    BigDecimal realizedProceedsUsd;

    @JsonProperty("holding_period")
    HoldingPeriod holdingPeriod;

    @JsonProperty("purpose")
    TransactionPurpose purpose;

    @JsonProperty("source")
    TransactionSource source;

    @JsonProperty("is_locked")
    boolean locked;

    @JsonProperty("group_id")
    Long groupId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .type(transaction.getType())
            .timestamp(transaction.getTimestamp())
            .fromAccountId(transaction.getFromAccountId())
            .toAccountId(transaction.getToAccountId())
            .amount(transaction.getAmount())
            .feeAmount(transaction.getFeeAmount())
            .feeCurrency(transaction.getFeeCurrency())
            .costBasisUsd(transaction.getCostBasisUsd())
            .proceedsUsd(transaction.getProceedsUsd())
            .fmvUsd(transaction.getFmvUsd())
            .realizedGainUsd(transaction.getRealizedGainUsd())
            .realizedProceedsUsd(transaction.getRealizedProceedsUsd())
            .holdingPeriod(transaction.getHoldingPeriod())
            .purpose(transaction.getPurpose())
            .source(transaction.getSource())
            .locked(transaction.isLocked())
            .groupId(transaction.getGroupId())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .build();
    }
}
