package com.flagship.btc_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.btc_ledger.lot.DisposalKind;
import com.flagship.btc_ledger.lot.HoldingPeriod;
import com.flagship.btc_ledger.lot.LotDisposal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class DisposalResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("lot_id")
    Long lotId;

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("disposed_at")
    Instant disposedAt;

    @JsonProperty("disposed_btc")
    BigDecimal disposedBtc;

    @JsonProperty("disposal_basis_usd")
    BigDecimal disposalBasisUsd;

    @JsonProperty("proceeds_usd")
    BigDecimal proceedsUsd;

    @JsonProperty("realized_gain_usd")
    BigDecimal realizedGainUsd;

    @JsonProperty("holding_period")
    HoldingPeriod holdingPeriod;

    @JsonProperty("kind")
    DisposalKind kind;

    @JsonProperty("reportable")
    boolean reportable;

    public static DisposalResponse from(LotDisposal disposal) {
        return DisposalResponse.builder()
            .id(disposal.getId())
            .lotId(disposal.getLotId())
            .transactionId(disposal.getTransactionId())
            .disposedAt(disposal.getDisposedAt())
            .disposedBtc(disposal.getDisposedBtc())
            .disposalBasisUsd(disposal.getDisposalBasisUsd())
            .proceedsUsd(disposal.getProceedsUsd())
            .realizedGainUsd(disposal.getRealizedGainUsd())
            .holdingPeriod(disposal.getHoldingPeriod())
            .kind(disposal.getKind())
            .reportable(disposal.isReportable())
            .build();
    }
}
