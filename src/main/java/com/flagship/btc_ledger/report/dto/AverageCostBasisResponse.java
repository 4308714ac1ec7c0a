package com.flagship.btc_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class AverageCostBasisResponse {

    @JsonProperty("average_cost_basis_usd")
    BigDecimal averageCostBasisUsd;

    @JsonProperty("btc_held")
    BigDecimal btcHeld;

    @JsonProperty("remaining_cost_basis_usd")
    BigDecimal remainingCostBasisUsd;
}
