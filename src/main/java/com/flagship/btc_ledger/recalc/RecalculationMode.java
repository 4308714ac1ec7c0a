package com.flagship.btc_ledger.recalc;

/**
 * Which rebuild runs after a mutation. Both give identical results;
 * FROM_CUTOFF only replays the part of history the change can affect.
 */
public enum RecalculationMode {
    FULL,
    FROM_CUTOFF
}
