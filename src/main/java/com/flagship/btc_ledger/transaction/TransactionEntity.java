package com.flagship.btc_ledger.transaction;

import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.lot.HoldingPeriod;
import com.flagship.btc_ledger.recalc.TransactionOutcome;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for a ledger transaction.
 *
 * No setters: inputs change only through {@link #replaceInputs}, the lock
 * through {@link #setLocked}, and the computed roll-up only through
 * {@link #applyOutcome}, which the replay calls.
 *
 * The idempotency key is a persistence concern, so it is passed to
 * fromDomain() separately and never changes afterwards.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_replay_order", columnList = "occurred_at, id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionType type;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "from_account_id", nullable = false)
    private Integer fromAccountId;

    @Column(name = "to_account_id", nullable = false)
    private Integer toAccountId;

    @Column(nullable = false, precision = 18, scale = 8)
    private BigDecimal amount;

    @Column(name = "fee_amount", precision = 18, scale = 8)
    private BigDecimal feeAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "fee_currency", length = 3)
    private CurrencyCode feeCurrency;

    @Column(name = "cost_basis_usd", precision = 18, scale = 2)
    private BigDecimal costBasisUsd;

    @Column(name = "proceeds_usd", precision = 18, scale = 2)
    private BigDecimal proceedsUsd;

    @Column(name = "fmv_usd", precision = 18, scale = 2)
    private BigDecimal fmvUsd;

    @Column(name = "realized_gain_usd", precision = 18, scale = 2)
    private BigDecimal realizedGainUsd;

    @Column(name = "realized_proceeds_usd", precision = 18, scale = 2)
    private BigDecimal realizedProceedsUsd;

    @Enumerated(EnumType.STRING)
    @Column(name = "holding_period", length = 10)
    private HoldingPeriod holdingPeriod;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private TransactionPurpose purpose;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private TransactionSource source;

    @Column(name = "is_locked", nullable = false)
    private boolean locked;

    @Column(name = "group_id")
    private Long groupId;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * The only way to create an entity. Computed fields start empty; the
     * replay that follows every insert fills them.
     */
    static TransactionEntity fromDomain(LedgerTransaction draft, String idempotencyKey) {
        return new TransactionEntity(
            null, // id - assigned by the database
            draft.getType(),
            draft.getTimestamp(),
            draft.getFromAccountId(),
            draft.getToAccountId(),
            draft.getAmount(),
            draft.getFeeAmount(),
            draft.getFeeCurrency(),
            draft.getCostBasisUsd(),
            draft.getProceedsUsd(),
            draft.getFmvUsd(),
            null,
            null,
            null,
            draft.getPurpose(),
            draft.getSource(),
            false,
            draft.getGroupId(),
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public LedgerTransaction toDomain() {
        return LedgerTransaction.builder()
            .id(id)
            .type(type)
            .timestamp(occurredAt)
            .fromAccountId(fromAccountId)
            .toAccountId(toAccountId)
            .amount(amount)
            .feeAmount(feeAmount)
            .feeCurrency(feeCurrency)
            .costBasisUsd(costBasisUsd)
            .proceedsUsd(proceedsUsd)
            .fmvUsd(fmvUsd)
            .realizedGainUsd(realizedGainUsd)
            .realizedProceedsUsd(realizedProceedsUsd)
            .holdingPeriod(holdingPeriod)
            .purpose(purpose)
            .source(source)
            .locked(locked)
            .groupId(groupId)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Full replacement of the user's inputs, the type included. Computed
     * fields are cleared until the next replay.
     *
     * @throws IllegalStateException if the transaction is locked
     */
    void replaceInputs(LedgerTransaction draft) {
        requireUnlocked();
        this.type = draft.getType();
        this.occurredAt = draft.getTimestamp();
        this.fromAccountId = draft.getFromAccountId();
        this.toAccountId = draft.getToAccountId();
        this.amount = draft.getAmount();
        this.feeAmount = draft.getFeeAmount();
        this.feeCurrency = draft.getFeeCurrency();
        this.costBasisUsd = draft.getCostBasisUsd();
        this.proceedsUsd = draft.getProceedsUsd();
        this.fmvUsd = draft.getFmvUsd();
        this.purpose = draft.getPurpose();
        this.source = draft.getSource();
        this.groupId = draft.getGroupId();
        this.realizedGainUsd = null;
        this.realizedProceedsUsd = null;
        this.holdingPeriod = null;
    }

    void setLocked(boolean locked) {
        this.locked = locked;
    }

    void requireUnlocked() {
        if (locked) {
            throw new IllegalStateException("Transaction " + id + " is locked and cannot be changed");
        }
    }

    /**
     * Writes the replay's roll-up. Proceeds as entered stay in proceedsUsd,
     * because the next replay reads them again; the fragments' proceeds go
     * to realizedProceedsUsd. For non-disposing transactions the entered
     * cost basis stays as it is.
     */
    public void applyOutcome(TransactionOutcome outcome) {
        if (!outcome.getTransactionId().equals(id)) {
            throw new IllegalArgumentException(
                "Outcome for transaction " + outcome.getTransactionId() + " applied to " + id);
        }
        if (outcome.isDisposing()) {
            this.costBasisUsd = outcome.getCostBasisUsd();
        }
        this.realizedGainUsd = outcome.getRealizedGainUsd();
        this.realizedProceedsUsd = outcome.getRealizedProceedsUsd();
        this.holdingPeriod = outcome.getHoldingPeriod();
    }
}
