package com.flagship.btc_ledger.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, Long> {

    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Whole history in replay order.
     */
    List<TransactionEntity> findAllByOrderByOccurredAtAscIdAsc();

    /**
     * The suffix of history a partial replay rebuilds.
     */
    List<TransactionEntity> findByOccurredAtGreaterThanEqualOrderByOccurredAtAscIdAsc(Instant cutoff);

    List<TransactionEntity> findByOccurredAtBeforeOrderByOccurredAtAscIdAsc(Instant cutoff);

    /**
     * Newest first, for listing.
     */
    List<TransactionEntity> findAllByOrderByOccurredAtDescIdDesc();
}
