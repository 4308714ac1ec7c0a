package com.flagship.btc_ledger.recalc;

/**
 * Sequential id counters for derived rows. Ids follow replay order, so two
 * replays of the same history produce the same ids.
 */
public class ReplayIds {

    private long nextEntryId;
    private long nextLotId;
    private long nextDisposalId;

    public ReplayIds(long nextEntryId, long nextLotId, long nextDisposalId) {
        this.nextEntryId = nextEntryId;
        this.nextLotId = nextLotId;
        this.nextDisposalId = nextDisposalId;
    }

    public long nextEntryId() {
        return nextEntryId++;
    }

    public long nextLotId() {
        return nextLotId++;
    }

    public long nextDisposalId() {
        return nextDisposalId++;
    }
}
