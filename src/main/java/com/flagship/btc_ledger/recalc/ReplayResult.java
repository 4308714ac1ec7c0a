package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.ledger.LedgerEntry;
import com.flagship.btc_ledger.lot.BitcoinLot;
import com.flagship.btc_ledger.lot.LotDisposal;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Everything one replay pass derived.
 *
 * carriedLots are the seed lots in their state after the pass; createdLots are
 * the lots the pass opened. A full replay has no carried lots.
 */
@Value
public class ReplayResult {
    List<LedgerEntry> entries;
    List<BitcoinLot> carriedLots;
    List<BitcoinLot> createdLots;
    List<LotDisposal> disposals;
    List<TransactionOutcome> outcomes;

    public List<BitcoinLot> allLots() {
        List<BitcoinLot> lots = new ArrayList<>(carriedLots);
        lots.addAll(createdLots);
        lots.sort(BitcoinLot.FIFO_ORDER);
        return lots;
    }

    public List<BitcoinLot> openLots() {
        return allLots().stream().filter(BitcoinLot::isOpen).toList();
    }

    public Map<Long, TransactionOutcome> outcomesById() {
        return outcomes.stream()
            .collect(Collectors.toMap(TransactionOutcome::getTransactionId, outcome -> outcome));
    }

    public int transactionCount() {
        return outcomes.size();
    }
}
