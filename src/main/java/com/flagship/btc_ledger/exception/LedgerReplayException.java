package com.flagship.btc_ledger.exception;

import com.flagship.btc_ledger.recalc.ReplayStage;
import lombok.Getter;

/**
 * Raised when a replay cannot continue. Carries the transaction being
 * replayed and the last stage it completed, so callers can tell which
 * step of which transaction broke the history.
 *
 * Any replay failure aborts the surrounding database transaction; the
 * previously committed ledger state stays in place.
 */
@Getter
public abstract class LedgerReplayException extends RuntimeException {

    private final Long transactionId;
    private final ReplayStage stage;

    protected LedgerReplayException(Long transactionId, ReplayStage stage, String message) {
        super(message);
        this.transactionId = transactionId;
        this.stage = stage;
    }
}
