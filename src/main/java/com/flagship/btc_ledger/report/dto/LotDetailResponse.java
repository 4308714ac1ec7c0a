package com.flagship.btc_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One lot together with every fragment taken from it.
 */
@Value
@Builder
@Jacksonized
public class LotDetailResponse {

    @JsonProperty("lot")
    LotResponse lot;

    @JsonProperty("disposals")
    List<DisposalResponse> disposals;
}
