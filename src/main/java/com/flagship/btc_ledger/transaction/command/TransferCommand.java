package com.flagship.btc_ledger.transaction.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
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
 * Moves funds between two of the user's own accounts. Only a BTC fee is
 * allowed; it is taken from the destination and disposes of lots, valued at
 * fmv_usd.
 */
@Value
@Builder
@Jacksonized
public class TransferCommand implements TransactionCommand {

    @JsonProperty("timestamp")
    Instant timestamp;

    @NotNull(message = "From account ID is required")
    @JsonProperty("from_account_id")
    Integer fromAccountId;

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

    @DecimalMin(value = "0", message = "Fair market value cannot be negative")
    @JsonProperty("fmv_usd")
    BigDecimal fmvUsd;

    @JsonProperty("group_id")
    Long groupId;

    @Override
    public TransactionType transactionType() {
        return TransactionType.TRANSFER;
    }

    @Override
    public LedgerTransaction toDraft(Clock clock) {
        return LedgerTransaction.builder()
            .type(TransactionType.TRANSFER)
            .timestamp(TransactionCommand.resolveTimestamp(timestamp, clock))
            .fromAccountId(TransactionCommand.accountOrUnknown(fromAccountId))
            .toAccountId(TransactionCommand.accountOrUnknown(toAccountId))
            .amount(amount)
            .feeAmount(feeAmount)
            .feeCurrency(TransactionCommand.feeCurrency(feeAmount, TransactionCommand.currencyOf(fromAccountId)))
            .fmvUsd(fmvUsd)
            .groupId(groupId)
            .build();
    }
}
