package com.flagship.btc_ledger.lot;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One fragment of one lot consumed by one transaction.
 *
 * reportable is false for fragments that are not capital-gains events
 * (gifts, donations, losses, and transfer fees when those are not taxed);
 * their proceeds and gain are zero.
 */
@Value
@Builder
public class LotDisposal {
    Long id;
    Long lotId;
    Long transactionId;
    Instant disposedAt;
    BigDecimal disposedBtc;
    BigDecimal disposalBasisUsd;
    BigDecimal proceedsUsd;
    BigDecimal realizedGainUsd;
    HoldingPeriod holdingPeriod;
    DisposalKind kind;
    boolean reportable;
}
