package com.flagship.btc_ledger.transaction.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * A request to record one transaction. Each variant carries only the fields
 * its type accepts; accounts the type fixes (External, the exchange legs)
 * are filled in by {@link #toDraft(Clock)}.
 *
 * The JSON "type" property selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DepositCommand.class, name = "DEPOSIT"),
    @JsonSubTypes.Type(value = WithdrawalCommand.class, name = "WITHDRAWAL"),
    @JsonSubTypes.Type(value = TransferCommand.class, name = "TRANSFER"),
    @JsonSubTypes.Type(value = BuyCommand.class, name = "BUY"),
    @JsonSubTypes.Type(value = SellCommand.class, name = "SELL")
})
public interface TransactionCommand {

    TransactionType transactionType();

    /**
     * Builds the unsaved transaction. A missing timestamp means now.
     */
    LedgerTransaction toDraft(Clock clock);

    /**
     * Postgres keeps microseconds; truncating here keeps the stored and the
     * in-memory timestamp identical.
     */
    static Instant resolveTimestamp(Instant requested, Clock clock) {
        Instant timestamp = requested != null ? requested : clock.instant();
        return timestamp.truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Fee currency when a fee is charged, otherwise null.
     */
    static CurrencyCode feeCurrency(BigDecimal feeAmount, CurrencyCode currency) {
        return feeAmount != null && feeAmount.signum() > 0 ? currency : null;
    }

    static CurrencyCode currencyOf(Integer accountId) {
        if (accountId == null) {
            return null;
        }
        return AccountDirectory.find(accountId).map(account -> account.getCurrency()).orElse(null);
    }

    static int accountOrUnknown(Integer accountId) {
        // 0 is never a valid id, so the rules reject it with a clear message
        return accountId != null ? accountId : 0;
    }
}
