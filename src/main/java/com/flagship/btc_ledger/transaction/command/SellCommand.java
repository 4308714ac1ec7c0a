package com.flagship.btc_ledger.transaction.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
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
 * Sells BTC from Exchange BTC for USD into Exchange USD. The USD fee is
 * deducted from the proceeds used for gains.
 */
@Value
@Builder
@Jacksonized
public class SellCommand implements TransactionCommand {

    @JsonProperty("timestamp")
    Instant timestamp;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Proceeds are required")
    @DecimalMin(value = "0", message = "Proceeds cannot be negative")
    @JsonProperty("proceeds_usd")
    BigDecimal proceedsUsd;

    @DecimalMin(value = "0", message = "Fee cannot be negative")
    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("group_id")
    Long groupId;

    @Override
    public TransactionType transactionType() {
        return TransactionType.SELL;
    }

    @Override
    public LedgerTransaction toDraft(Clock clock) {
        return LedgerTransaction.builder()
            .type(TransactionType.SELL)
            .timestamp(TransactionCommand.resolveTimestamp(timestamp, clock))
            .fromAccountId(AccountDirectory.EXCHANGE_BTC)
            .toAccountId(AccountDirectory.EXCHANGE_USD)
            .amount(amount)
            .proceedsUsd(proceedsUsd)
            .feeAmount(feeAmount)
            .feeCurrency(TransactionCommand.feeCurrency(feeAmount, CurrencyCode.USD))
            .groupId(groupId)
            .build();
    }
}
