package com.flagship.btc_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.ledger.EntryType;
import com.flagship.btc_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class LedgerEntryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("account_id")
    int accountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("entry_type")
    EntryType entryType;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .transactionId(entry.getTransactionId())
            .accountId(entry.getAccountId())
            .amount(entry.getAmount())
            .currency(entry.getCurrency())
            .entryType(entry.getEntryType())
            .build();
    }
}
