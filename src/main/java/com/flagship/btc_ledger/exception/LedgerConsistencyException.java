package com.flagship.btc_ledger.exception;

import com.flagship.btc_ledger.recalc.ReplayStage;

/**
 * Postings or lot arithmetic broke an invariant. This is a bug, never a
 * user error.
 */
public class LedgerConsistencyException extends LedgerReplayException {

    public LedgerConsistencyException(Long transactionId, ReplayStage stage, String message) {
        super(transactionId, stage, message);
    }
}
