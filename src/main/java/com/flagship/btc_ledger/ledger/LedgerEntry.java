package com.flagship.btc_ledger.ledger;

import com.flagship.btc_ledger.account.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A single signed posting: negative leaves the account, positive enters it.
 *
 * Key invariant: for every transaction, the entries in each currency sum to zero.
 */
@Value
public class LedgerEntry {
    Long id;
    Long transactionId;
    int accountId;
    BigDecimal amount;
    CurrencyCode currency;
    EntryType entryType;
}
