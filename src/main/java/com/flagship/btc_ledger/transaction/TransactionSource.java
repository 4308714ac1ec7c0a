package com.flagship.btc_ledger.transaction;

/**
 * Where deposited funds came from. Only used for income reporting.
 */
public enum TransactionSource {
    NA,
    MY_BTC,
    GIFT,
    INCOME,
    INTEREST,
    REWARD
}
