package com.flagship.btc_ledger.account;

/**
 * Role an account plays in postings. Transaction rules are written against
 * kinds rather than raw ids.
 */
public enum AccountKind {
    BANK,
    WALLET,
    EXCHANGE_USD,
    EXCHANGE_BTC,
    FEES,
    EXTERNAL
}
