package com.flagship.btc_ledger.transaction.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionSource;
import com.flagship.btc_ledger.transaction.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Money arriving from outside. A BTC deposit opens a lot whose basis is
 * cost_basis_usd (zero when absent). The fee is charged in the currency of
 * the receiving account.
 */
@Value
@Builder
@Jacksonized
public class DepositCommand implements TransactionCommand {

    @JsonProperty("timestamp")
    Instant timestamp;

    @NotNull(message = "To account ID is required")
    @JsonProperty("to_account_id")
    Integer toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0", message = "Fee cannot be negative")
    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @DecimalMin(value = "0", message = "Cost basis cannot be negative")
    @JsonProperty("cost_basis_usd")
    BigDecimal costBasisUsd;

    @JsonProperty("source")
    TransactionSource source;

    @JsonProperty("group_id")
    Long groupId;

    @Override
    public TransactionType transactionType() {
        return TransactionType.DEPOSIT;
    }

    @Override
    public LedgerTransaction toDraft(Clock clock) {
        return LedgerTransaction.builder()
            .type(TransactionType.DEPOSIT)
            .timestamp(TransactionCommand.resolveTimestamp(timestamp, clock))
            .fromAccountId(AccountDirectory.EXTERNAL)
            .toAccountId(TransactionCommand.accountOrUnknown(toAccountId))
            .amount(amount)
            .feeAmount(feeAmount)
            .feeCurrency(TransactionCommand.feeCurrency(feeAmount, TransactionCommand.currencyOf(toAccountId)))
            .costBasisUsd(costBasisUsd)
            .source(source != null ? source : TransactionSource.NA)
            .groupId(groupId)
            .build();
    }
}
