package com.flagship.btc_ledger.lot;

public enum HoldingPeriod {
    SHORT,
    LONG
}
