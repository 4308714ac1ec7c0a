package com.flagship.btc_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.recalc.ReplayResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RecalculationResponse {

    @JsonProperty("transactions")
    int transactions;

    @JsonProperty("ledger_entries")
    int ledgerEntries;

    @JsonProperty("lots")
    int lots;

    @JsonProperty("open_lots")
    int openLots;

    @JsonProperty("disposals")
    int disposals;

    public static RecalculationResponse from(ReplayResult result) {
        return RecalculationResponse.builder()
            .transactions(result.transactionCount())
            .ledgerEntries(result.getEntries().size())
            .lots(result.allLots().size())
            .openLots(result.openLots().size())
            .disposals(result.getDisposals().size())
            .build();
    }
}
