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
 * Buys BTC into Exchange BTC, paid from Bank or Exchange USD. The USD fee is
 * added to the new lot's basis.
 */
@Value
@Builder
@Jacksonized
public class BuyCommand implements TransactionCommand {

    @JsonProperty("timestamp")
    Instant timestamp;

    @NotNull(message = "From account ID is required")
    @JsonProperty("from_account_id")
    Integer fromAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Cost basis is required")
    @DecimalMin(value = "0", message = "Cost basis cannot be negative")
    @JsonProperty("cost_basis_usd")
    BigDecimal costBasisUsd;

    @DecimalMin(value = "0", message = "Fee cannot be negative")
    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("group_id")
    Long groupId;

    @Override
    public TransactionType transactionType() {
        return TransactionType.BUY;
    }

    @Override
    public LedgerTransaction toDraft(Clock clock) {
        return LedgerTransaction.builder()
            .type(TransactionType.BUY)
            .timestamp(TransactionCommand.resolveTimestamp(timestamp, clock))
            .fromAccountId(TransactionCommand.accountOrUnknown(fromAccountId))
            .toAccountId(AccountDirectory.EXCHANGE_BTC)
            .amount(amount)
            .costBasisUsd(costBasisUsd)
            .feeAmount(feeAmount)
            .feeCurrency(TransactionCommand.feeCurrency(feeAmount, CurrencyCode.USD))
            .groupId(groupId)
            .build();
    }
}
