package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.exception.LedgerReplayException;
import com.flagship.btc_ledger.lot.BitcoinLot;
import com.flagship.btc_ledger.observability.LedgerMetrics;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionEntity;
import com.flagship.btc_ledger.transaction.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds ledger entries, lots and disposals from transaction history.
 *
 * Two entry points, with identical results (row ids included):
 * - recalculateAll: wipe everything and replay the whole history
 * - recalculateFrom: rewind to a cutoff and replay only what follows it
 *
 * Both run in the caller's transaction and take the ledger advisory lock,
 * so a failed replay leaves the last committed state untouched. Callers that
 * mutate history go through {@link LedgerWriteCoordinator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecalculationService {

    private final TransactionRepository transactionRepository;
    private final LedgerSnapshotStore snapshotStore;
    private final LedgerReplayer replayer;
    private final LedgerMetrics ledgerMetrics;

    @Value("${ledger.recalculation.mode:FULL}")
    private RecalculationMode mode = RecalculationMode.FULL;

    /**
     * Scorched-earth rebuild of all derived state.
     *
     * @throws LedgerReplayException if any transaction in history cannot be applied
     */
    @Transactional
    public ReplayResult recalculateAll() {
        long startTime = System.currentTimeMillis();
        snapshotStore.lockLedger();
        transactionRepository.flush();

        try {
            List<TransactionEntity> entities = transactionRepository.findAllByOrderByOccurredAtAscIdAsc();
            snapshotStore.wipeAll();

            ReplayResult result = replayer.replay(toDomain(entities));
            snapshotStore.persist(result);
            applyOutcomes(entities, result);

            finish("full", startTime, result);
            return result;

        } catch (RuntimeException e) {
            fail("full", startTime, e);
            throw e;
        }
    }

    /**
     * Rebuilds only the transactions at or after the cutoff, on top of the
     * lots as they stood just before it.
     *
     * @throws LedgerReplayException if any transaction from the cutoff on cannot be applied
     */
    @Transactional
    public ReplayResult recalculateFrom(Instant cutoff) {
        long startTime = System.currentTimeMillis();
        snapshotStore.lockLedger();
        transactionRepository.flush();

        try {
            snapshotStore.rewindFrom(cutoff);
            ReplaySeed seed = snapshotStore.currentSeed();

            List<TransactionEntity> suffix =
                transactionRepository.findByOccurredAtGreaterThanEqualOrderByOccurredAtAscIdAsc(cutoff);
            ReplayResult result = replayer.replay(toDomain(suffix), seed);
            snapshotStore.persist(result);
            applyOutcomes(suffix, result);

            log.debug("Partial replay from {} carried {} open lots", cutoff, seed.getOpenLots().size());
            finish("from_cutoff", startTime, result);
            return result;

        } catch (RuntimeException e) {
            fail("from_cutoff", startTime, e);
            throw e;
        }
    }

    /**
     * Rebuild after a change whose earliest affected point is the cutoff,
     * using the configured mode.
     */
    @Transactional
    public ReplayResult rebuildAfterChange(Instant cutoff) {
        return mode == RecalculationMode.FULL ? recalculateAll() : recalculateFrom(cutoff);
    }

    /**
     * Drops derived rows owned by transactions at or after the cutoff. Used
     * before deleting a transaction, whose rows would otherwise block the delete.
     */
    @Transactional
    public void discardFrom(Instant cutoff) {
        snapshotStore.lockLedger();
        transactionRepository.flush();
        snapshotStore.rewindFrom(cutoff);
    }

    /**
     * Lots that were open just before the given instant, computed by an
     * in-memory replay. Stored state is never touched.
     */
    @Transactional(readOnly = true)
    public List<BitcoinLot> openLotsAsOf(Instant asOf) {
        List<TransactionEntity> before = transactionRepository.findByOccurredAtBeforeOrderByOccurredAtAscIdAsc(asOf);
        return replayer.replay(toDomain(before)).openLots();
    }

    public RecalculationMode getMode() {
        return mode;
    }

    private static List<LedgerTransaction> toDomain(List<TransactionEntity> entities) {
        return entities.stream().map(TransactionEntity::toDomain).toList();
    }

    private static void applyOutcomes(List<TransactionEntity> entities, ReplayResult result) {
        Map<Long, TransactionOutcome> outcomes = result.outcomesById();
        for (TransactionEntity entity : entities) {
            entity.applyOutcome(outcomes.get(entity.getId()));
        }
    }

    private void finish(String runMode, long startTime, ReplayResult result) {
        long duration = System.currentTimeMillis() - startTime;
        ledgerMetrics.recordReplay(runMode, "success", Duration.ofMillis(duration));
        log.info("Replay ({}) finished: transactions={}, entries={}, lotsCreated={}, disposals={}, duration={}ms",
            runMode, result.transactionCount(), result.getEntries().size(),
            result.getCreatedLots().size(), result.getDisposals().size(), duration);
    }

    private void fail(String runMode, long startTime, RuntimeException e) {
        long duration = System.currentTimeMillis() - startTime;
        String outcome = e instanceof LedgerReplayException ? "rejected" : "error";
        ledgerMetrics.recordReplay(runMode, outcome, Duration.ofMillis(duration));
        log.warn("Replay ({}) failed after {}ms: {}", runMode, duration, e.getMessage());
    }
}
