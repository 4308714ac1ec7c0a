package com.flagship.btc_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.ledger.AccountBalance;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class BalanceResponse {

    @JsonProperty("account_id")
    int accountId;

    @JsonProperty("name")
    String name;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("balance")
    BigDecimal balance;

    public static BalanceResponse from(AccountBalance balance) {
        return BalanceResponse.builder()
            .accountId(balance.getAccountId())
            .name(balance.getAccountName())
            .currency(balance.getCurrency())
            .balance(balance.getBalance())
            .build();
    }
}
