package com.flagship.btc_ledger.transaction;

public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    TRANSFER,
    BUY,
    SELL
}
