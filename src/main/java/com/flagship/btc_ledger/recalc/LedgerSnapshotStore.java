package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.ledger.LedgerService;
import com.flagship.btc_ledger.lot.LotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Stored derived state: ledger entries, lots and disposals.
 *
 * Every method must run inside the caller's transaction; a replay's wipe,
 * rewind and writes commit or roll back together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerSnapshotStore {

    /**
     * Key of the transaction-scoped advisory lock serializing ledger writers
     * across processes.
     */
    static final long LEDGER_LOCK_KEY = 0x4254434C4544L;

    private static final String OWNED_FROM_CUTOFF =
        "SELECT id FROM transactions WHERE occurred_at >= ?";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerService ledgerService;
    private final LotRepository lotRepository;

    /**
     * Blocks until no other database transaction holds the ledger. Released
     * automatically at commit or rollback.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockLedger() {
        jdbcTemplate.execute("SELECT pg_advisory_xact_lock(" + LEDGER_LOCK_KEY + ")");
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void wipeAll() {
        int disposals = jdbcTemplate.update("DELETE FROM lot_disposals");
        int lots = jdbcTemplate.update("DELETE FROM bitcoin_lots");
        int entries = jdbcTemplate.update("DELETE FROM ledger_entries");
        log.debug("Wiped derived state: entries={}, lots={}, disposals={}", entries, lots, disposals);
    }

    /**
     * Rolls derived state back to just before the cutoff: lots opened earlier
     * get back the BTC that transactions at or after the cutoff took from them,
     * then every row owned by those transactions is deleted.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void rewindFrom(Instant cutoff) {
        Timestamp at = Timestamp.from(cutoff);
        int restored = jdbcTemplate.update(
            "UPDATE bitcoin_lots l SET remaining_btc = l.remaining_btc + d.disposed " +
            "FROM (SELECT lot_id, SUM(disposed_btc) AS disposed FROM lot_disposals " +
            "      WHERE transaction_id IN (" + OWNED_FROM_CUTOFF + ") GROUP BY lot_id) d " +
            "WHERE l.id = d.lot_id",
            at);
        int disposals = jdbcTemplate.update(
            "DELETE FROM lot_disposals WHERE transaction_id IN (" + OWNED_FROM_CUTOFF + ")", at);
        int lots = jdbcTemplate.update(
            "DELETE FROM bitcoin_lots WHERE created_txn_id IN (" + OWNED_FROM_CUTOFF + ")", at);
        int entries = jdbcTemplate.update(
            "DELETE FROM ledger_entries WHERE transaction_id IN (" + OWNED_FROM_CUTOFF + ")", at);
        log.debug("Rewound to {}: lotsRestored={}, entries={}, lots={}, disposals={}",
            cutoff, restored, entries, lots, disposals);
    }

    /**
     * Open lots and next free ids of what is currently stored. Taken right
     * after a rewind, this is the state a replay of the suffix starts from.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ReplaySeed currentSeed() {
        return new ReplaySeed(
            lotRepository.findOpenLots(),
            nextId("ledger_entries"),
            nextId("bitcoin_lots"),
            nextId("lot_disposals"));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void persist(ReplayResult result) {
        ledgerService.insertEntries(result.getEntries());
        lotRepository.updateRemaining(result.getCarriedLots());
        lotRepository.insertLots(result.getCreatedLots());
        lotRepository.insertDisposals(result.getDisposals());
    }

    private long nextId(String table) {
        Long max = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(id), 0) FROM " + table, Long.class);
        return (max != null ? max : 0) + 1;
    }
}
