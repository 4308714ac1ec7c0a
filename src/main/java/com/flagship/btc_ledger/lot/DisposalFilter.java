package com.flagship.btc_ledger.lot;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional criteria for listing disposals. Null fields match everything;
 * the date range is half-open, [from, to).
 */
@Value
@Builder
public class DisposalFilter {
    Instant from;
    Instant to;
    HoldingPeriod holdingPeriod;
    boolean reportableOnly;

    public static DisposalFilter all() {
        return DisposalFilter.builder().build();
    }
}
