package com.flagship.btc_ledger.ledger;

import com.flagship.btc_ledger.account.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class AccountBalance {
    int accountId;
    String accountName;
    CurrencyCode currency;
    BigDecimal balance;
}
