package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.exception.LedgerConsistencyException;
import com.flagship.btc_ledger.exception.LedgerReplayException;
import com.flagship.btc_ledger.ledger.LedgerEntry;
import com.flagship.btc_ledger.ledger.LedgerPoster;
import com.flagship.btc_ledger.lot.BitcoinLot;
import com.flagship.btc_ledger.lot.FifoDisposalMatcher;
import com.flagship.btc_ledger.lot.LotBook;
import com.flagship.btc_ledger.lot.LotDisposal;
import com.flagship.btc_ledger.lot.LotManager;
import com.flagship.btc_ledger.lot.TaxPolicy;
import com.flagship.btc_ledger.observability.CorrelationContext;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic replay of transaction history.
 *
 * A pure function of its inputs: no database, no clock. Transactions are
 * sorted into replay order here, so the order they are passed in never
 * matters. Each transaction is posted, then opens a lot or consumes lots,
 * then gets its roll-up. The first failure aborts the whole pass.
 */
@Slf4j
public class LedgerReplayer {

    private final LedgerPoster poster;
    private final LotManager lotManager;
    private final FifoDisposalMatcher matcher;

    public LedgerReplayer(TaxPolicy taxPolicy) {
        this(new LedgerPoster(), new LotManager(taxPolicy), new FifoDisposalMatcher(taxPolicy));
    }

    public LedgerReplayer(LedgerPoster poster, LotManager lotManager, FifoDisposalMatcher matcher) {
        this.poster = poster;
        this.lotManager = lotManager;
        this.matcher = matcher;
    }

    public ReplayResult replay(List<LedgerTransaction> transactions) {
        return replay(transactions, ReplaySeed.empty());
    }

    /**
     * Replays the given transactions on top of the seed's open lots.
     *
     * @throws LedgerReplayException if any transaction cannot be applied
     */
    public ReplayResult replay(List<LedgerTransaction> transactions, ReplaySeed seed) {
        transactions.forEach(LedgerReplayer::requirePersisted);
        List<LedgerTransaction> ordered = transactions.stream()
            .sorted(LedgerTransaction.REPLAY_ORDER)
            .toList();

        List<BitcoinLot> carried = seed.getOpenLots().stream().map(BitcoinLot::copy).toList();
        Set<Long> carriedIds = carried.stream().map(BitcoinLot::getId).collect(Collectors.toSet());
        LotBook book = new LotBook(carried);
        ReplayIds ids = seed.ids();

        List<LedgerEntry> entries = new ArrayList<>();
        List<BitcoinLot> created = new ArrayList<>();
        List<LotDisposal> disposals = new ArrayList<>();
        List<TransactionOutcome> outcomes = new ArrayList<>();

        for (LedgerTransaction transaction : ordered) {
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transaction.getId()));
            ReplayStage stage = ReplayStage.PENDING;
            try {
                entries.addAll(poster.post(transaction, ids::nextEntryId));
                stage = ReplayStage.POSTED;

                Optional<BitcoinLot> lot = lotManager.acquire(transaction, book, ids::nextLotId);
                if (lot.isPresent()) {
                    created.add(lot.get());
                    stage = ReplayStage.LOT_CREATED;
                }

                List<LotDisposal> fragments = matcher.dispose(transaction, book, ids::nextDisposalId);
                if (!fragments.isEmpty()) {
                    disposals.addAll(fragments);
                    stage = ReplayStage.DISPOSED;
                }

                outcomes.add(fragments.isEmpty()
                    ? TransactionOutcome.none(transaction.getId())
                    : TransactionOutcome.rollUp(transaction.getId(), fragments));
                stage = ReplayStage.FINALIZED;
                log.debug("Replayed {} transaction {} at {}",
                    transaction.getType(), transaction.getId(), transaction.getTimestamp());

            } catch (LedgerReplayException e) {
                log.warn("Replay stopped at transaction {} after stage {}: {}",
                    transaction.getId(), e.getStage(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.error("Replay failed at transaction {} after stage {}", transaction.getId(), stage, e);
                throw new LedgerConsistencyException(transaction.getId(), stage, e.getMessage());
            } finally {
                MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            }
        }

        List<BitcoinLot> carriedAfter = book.allLots().stream()
            .filter(lot -> carriedIds.contains(lot.getId()))
            .toList();
        return new ReplayResult(entries, carriedAfter, created, disposals, outcomes);
    }

    private static void requirePersisted(LedgerTransaction transaction) {
        if (transaction.getId() == null) {
            throw new IllegalArgumentException("Only persisted transactions can be replayed");
        }
    }
}
