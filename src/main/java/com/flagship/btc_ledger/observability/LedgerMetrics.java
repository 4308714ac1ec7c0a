package com.flagship.btc_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer metrics for the ledger.
 *
 * Metrics exposed:
 * - ledger.transactions.mutations: create/update/delete/lock calls by status
 * - ledger.replay.duration: time spent replaying, by mode (full, from_cutoff)
 * - ledger.replay.runs: replay passes by mode and outcome
 * - ledger.idempotency: idempotency key hits and misses
 * - ledger.lots.open / ledger.btc.held: gauges refreshed by {@link MetricsScheduler}
 *
 * Gauges read cached values so a Prometheus scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final JdbcTemplate jdbcTemplate;

    private final AtomicLong openLotCount = new AtomicLong(0);
    private final AtomicReference<BigDecimal> btcHeld = new AtomicReference<>(BigDecimal.ZERO);

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.lots.open", openLotCount, AtomicLong::get)
                .description("Number of lots with BTC remaining")
                .register(registry);

        Gauge.builder("ledger.btc.held", btcHeld, held -> held.get().doubleValue())
                .description("BTC remaining across all open lots")
                .baseUnit("btc")
                .register(registry);

        log.info("Ledger metrics registered with Micrometer");
    }

    public void recordMutation(String operation, String status) {
        registry.counter("ledger.transactions.mutations",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordReplay(String mode, String outcome, Duration duration) {
        registry.timer("ledger.replay.duration", "mode", sanitizeTag(mode)).record(duration);
        registry.counter("ledger.replay.runs",
                "mode", sanitizeTag(mode),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    /**
     * Refreshes the cached gauge values. Called periodically by the scheduler.
     */
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Long open = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM bitcoin_lots WHERE remaining_btc > 0", Long.class);
            BigDecimal held = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(remaining_btc), 0) FROM bitcoin_lots", BigDecimal.class);

            openLotCount.set(open != null ? open : 0);
            btcHeld.set(held != null ? held : BigDecimal.ZERO);

            log.debug("Ledger metrics refreshed: openLots={}, btcHeld={}", open, held);

        } catch (Exception e) {
            log.warn("Failed to refresh ledger metrics: {}", e.getMessage());
        }
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
