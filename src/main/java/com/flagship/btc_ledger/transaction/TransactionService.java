package com.flagship.btc_ledger.transaction;

import com.flagship.btc_ledger.exception.TransactionNotFoundException;
import com.flagship.btc_ledger.observability.CorrelationContext;
import com.flagship.btc_ledger.observability.LedgerMetrics;
import com.flagship.btc_ledger.recalc.LedgerWriteCoordinator;
import com.flagship.btc_ledger.recalc.RecalculationService;
import com.flagship.btc_ledger.transaction.command.TransactionCommand;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Creates, edits, deletes and locks transactions.
 *
 * Every mutation and the rebuild it triggers form one atomic unit under the
 * ledger write lock: if the rebuild fails (a backdated edit that leaves a
 * later sell without enough BTC, say) the mutation is rolled back with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionRepository repository;
    private final TransactionRules rules;
    private final RecalculationService recalculationService;
    private final LedgerWriteCoordinator writeCoordinator;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Value
    public static class CreateResult {
        LedgerTransaction transaction;
        boolean created;
    }

    /**
     * Records a new transaction and rebuilds derived state from its timestamp.
     *
     * With an idempotency key that was already used, returns the transaction
     * recorded the first time and creates nothing.
     *
     * @throws IllegalArgumentException if the transaction breaks an account or amount rule
     */
    public CreateResult create(TransactionCommand command, String idempotencyKey) {
        return timed("create", () -> writeCoordinator.write(() -> {
            if (idempotencyKey != null) {
                Optional<TransactionEntity> existing = repository.findByIdempotencyKey(idempotencyKey);
                if (existing.isPresent()) {
                    ledgerMetrics.recordIdempotencyHit();
                    log.info("Idempotency key already used, returning transaction {}", existing.get().getId());
                    return new CreateResult(existing.get().toDomain(), false);
                }
                ledgerMetrics.recordIdempotencyMiss();
            }

            LedgerTransaction draft = command.toDraft(clock);
            rules.validate(draft);

            TransactionEntity saved = repository.saveAndFlush(TransactionEntity.fromDomain(draft, idempotencyKey));
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(saved.getId()));

            recalculationService.rebuildAfterChange(saved.getOccurredAt());

            log.info("Transaction created: type={}, amount={}, timestamp={}",
                saved.getType(), saved.getAmount().toPlainString(), saved.getOccurredAt());
            return new CreateResult(saved.toDomain(), true);
        }));
    }

    /**
     * Replaces every input of an unlocked transaction, its type included.
     *
     * @throws TransactionNotFoundException if no transaction has this id
     * @throws IllegalStateException if the transaction is locked
     */
    public LedgerTransaction update(Long id, TransactionCommand command) {
        return timed("update", () -> writeCoordinator.write(() -> {
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(id));
            TransactionEntity entity = load(id);
            entity.requireUnlocked();

            LedgerTransaction draft = command.toDraft(clock);
            rules.validate(draft);

            Instant previous = entity.getOccurredAt();
            entity.replaceInputs(draft);
            repository.flush();

            Instant cutoff = previous.isBefore(draft.getTimestamp()) ? previous : draft.getTimestamp();
            recalculationService.rebuildAfterChange(cutoff);

            log.info("Transaction updated: type={}, cutoff={}", entity.getType(), cutoff);
            return entity.toDomain();
        }));
    }

    /**
     * @throws TransactionNotFoundException if no transaction has this id
     * @throws IllegalStateException if the transaction is locked
     */
    public void delete(Long id) {
        timed("delete", () -> writeCoordinator.write(() -> {
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(id));
            TransactionEntity entity = load(id);
            entity.requireUnlocked();

            Instant cutoff = entity.getOccurredAt();
            recalculationService.discardFrom(cutoff);
            repository.delete(entity);
            repository.flush();
            recalculationService.rebuildAfterChange(cutoff);

            log.info("Transaction deleted: type={}, cutoff={}", entity.getType(), cutoff);
            return null;
        }));
    }

    /**
     * Locks or unlocks a transaction. Locked transactions still replay; they
     * only refuse edits and deletes.
     *
     * @throws TransactionNotFoundException if no transaction has this id
     */
    public LedgerTransaction setLocked(Long id, boolean locked) {
        return timed("lock", () -> writeCoordinator.write(() -> {
            TransactionEntity entity = load(id);
            entity.setLocked(locked);
            repository.flush();
            log.info("Transaction {} {}", id, locked ? "locked" : "unlocked");
            return entity.toDomain();
        }));
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> list() {
        return repository.findAllByOrderByOccurredAtDescIdDesc().stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findById(Long id) {
        return repository.findById(id).map(TransactionEntity::toDomain);
    }

    private TransactionEntity load(Long id) {
        return repository.findById(id).orElseThrow(() -> new TransactionNotFoundException(id));
    }

    private <T> T timed(String operation, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        try {
            T result = work.get();
            ledgerMetrics.recordMutation(operation, "success");
            return result;
        } catch (RuntimeException e) {
            ledgerMetrics.recordMutation(operation, "error");
            log.error("Transaction {} failed: error={}, duration={}ms",
                operation, e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }
}
