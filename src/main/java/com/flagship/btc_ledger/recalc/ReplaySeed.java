package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.lot.BitcoinLot;
import lombok.Value;

import java.util.List;

/**
 * Starting point of a partial replay: the lots still open just before the
 * cutoff and the next free id of each derived table.
 */
@Value
public class ReplaySeed {
    List<BitcoinLot> openLots;
    long nextEntryId;
    long nextLotId;
    long nextDisposalId;

    public static ReplaySeed empty() {
        return new ReplaySeed(List.of(), 1, 1, 1);
    }

    ReplayIds ids() {
        return new ReplayIds(nextEntryId, nextLotId, nextDisposalId);
    }
}
