package com.flagship.btc_ledger.transaction.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionPurpose;
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
 * Money leaving to the outside. A BTC withdrawal consumes lots for the
 * amount plus the fee; SPENT requires proceeds_usd, while GIFT, DONATION and
 * LOST realize no gain.
 */
@Value
@Builder
@Jacksonized
public class WithdrawalCommand implements TransactionCommand {

    @JsonProperty("timestamp")
    Instant timestamp;

    @NotNull(message = "From account ID is required")
    @JsonProperty("from_account_id")
    Integer fromAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0", message = "Fee cannot be negative")
    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("purpose")
    TransactionPurpose purpose;

    @DecimalMin(value = "0", message = "Proceeds cannot be negative")
    @JsonProperty("proceeds_usd")
    BigDecimal proceedsUsd;

    @DecimalMin(value = "0", message = "Fair market value cannot be negative")
    @JsonProperty("fmv_usd")
    BigDecimal fmvUsd;

    @JsonProperty("group_id")
    Long groupId;

    @Override
    public TransactionType transactionType() {
        return TransactionType.WITHDRAWAL;
    }

    @Override
    public LedgerTransaction toDraft(Clock clock) {
        return LedgerTransaction.builder()
            .type(TransactionType.WITHDRAWAL)
            .timestamp(TransactionCommand.resolveTimestamp(timestamp, clock))
            .fromAccountId(TransactionCommand.accountOrUnknown(fromAccountId))
            .toAccountId(AccountDirectory.EXTERNAL)
            .amount(amount)
            .feeAmount(feeAmount)
            .feeCurrency(TransactionCommand.feeCurrency(feeAmount, TransactionCommand.currencyOf(fromAccountId)))
            .proceedsUsd(proceedsUsd)
            .fmvUsd(fmvUsd)
            .purpose(purpose != null ? purpose : TransactionPurpose.NA)
            .groupId(groupId)
            .build();
    }
}
