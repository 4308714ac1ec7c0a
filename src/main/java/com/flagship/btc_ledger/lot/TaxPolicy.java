package com.flagship.btc_ledger.lot;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Tax settings the lot engine applies.
 *
 * longTermThresholdDays: a fragment is LONG when more whole days than this
 * separate acquisition from disposal.
 * transferFeeTaxable: whether the BTC paid as a transfer fee is a reportable
 * disposal valued at the transfer's fair market value.
 * capitalizeTradeFees: whether USD trade fees raise a Buy's basis and lower a
 * Sell's proceeds.
 */
@Value
@Builder
public class TaxPolicy {

    public static final int DEFAULT_LONG_TERM_THRESHOLD_DAYS = 365;

    @Builder.Default
    int longTermThresholdDays = DEFAULT_LONG_TERM_THRESHOLD_DAYS;

    @Builder.Default
    boolean transferFeeTaxable = true;

    @Builder.Default
    boolean capitalizeTradeFees = true;

    public static TaxPolicy defaults() {
        return TaxPolicy.builder().build();
    }

    public HoldingPeriod classify(Instant acquiredAt, Instant disposedAt) {
        long heldDays = Duration.between(acquiredAt, disposedAt).toDays();
        return heldDays > longTermThresholdDays ? HoldingPeriod.LONG : HoldingPeriod.SHORT;
    }
}
