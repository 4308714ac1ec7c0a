package com.flagship.btc_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.lot.BitcoinLot;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class LotResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("created_txn_id")
    Long createdTxnId;

    @JsonProperty("acquired_date")
    Instant acquiredDate;

    @JsonProperty("total_btc")
    BigDecimal totalBtc;

    @JsonProperty("remaining_btc")
    BigDecimal remainingBtc;

    @JsonProperty("cost_basis_usd")
    BigDecimal costBasisUsd;

    @JsonProperty("remaining_cost_basis_usd")
    BigDecimal remainingCostBasisUsd;

    public static LotResponse from(BitcoinLot lot) {
        return LotResponse.builder()
            .id(lot.getId())
            .createdTxnId(lot.getCreatedTxnId())
            .acquiredDate(lot.getAcquiredDate())
            .totalBtc(lot.getTotalBtc())
            .remainingBtc(lot.getRemainingBtc())
            .costBasisUsd(lot.getCostBasisUsd())
            .remainingCostBasisUsd(lot.remainingCostBasisUsd())
            .build();
    }
}
