package com.flagship.btc_ledger.recalc;

/**
 * Per-transaction progress through a replay pass. A transaction that
 * neither acquires nor disposes goes straight from POSTED to FINALIZED.
 */
public enum ReplayStage {
    PENDING,
    POSTED,
    LOT_CREATED,
    DISPOSED,
    FINALIZED
}
