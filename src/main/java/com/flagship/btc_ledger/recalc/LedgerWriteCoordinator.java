package com.flagship.btc_ledger.recalc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer gate for every ledger mutation.
 *
 * The fair in-process lock orders writers within this instance; the
 * Postgres advisory lock taken inside the transaction orders them across
 * instances. The database transaction commits before the in-process lock is
 * released, so the next writer always starts from committed state.
 */
@Component
@Slf4j
public class LedgerWriteCoordinator {

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;
    private final LedgerSnapshotStore snapshotStore;

    public LedgerWriteCoordinator(TransactionTemplate transactionTemplate, LedgerSnapshotStore snapshotStore) {
        this.transactionTemplate = transactionTemplate;
        this.snapshotStore = snapshotStore;
    }

    public <T> T write(Supplier<T> work) {
        long waitStart = System.nanoTime();
        writeLock.lock();
        try {
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - waitStart);
            if (waitedMs > 0) {
                log.debug("Acquired ledger write lock after {}ms", waitedMs);
            }
            return transactionTemplate.execute(status -> {
                snapshotStore.lockLedger();
                return work.get();
            });
        } finally {
            writeLock.unlock();
        }
    }
}
