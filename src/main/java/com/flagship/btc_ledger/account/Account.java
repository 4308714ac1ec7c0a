package com.flagship.btc_ledger.account;

import lombok.Value;

/**
 * A fixed ledger account. The currency never changes after seeding.
 * External is the only account without a currency: it takes the currency
 * of whatever flows through it.
 */
@Value
public class Account {
    int id;
    String name;
    CurrencyCode currency;
    AccountKind kind;

    public boolean isExternal() {
        return kind == AccountKind.EXTERNAL;
    }

    public boolean isFeeAccount() {
        return kind == AccountKind.FEES;
    }

    /**
     * Internal accounts that hold the user's own money: everything except
     * External and the two fee sinks.
     */
    public boolean isHolding() {
        return !isExternal() && !isFeeAccount();
    }

    public boolean holds(CurrencyCode code) {
        return currency == code;
    }
}
