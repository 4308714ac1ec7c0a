package com.flagship.btc_ledger.lot;

import com.flagship.btc_ledger.account.CurrencyCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;

/**
 * An acquisition lot of BTC.
 *
 * Everything except remainingBtc is fixed at creation. remainingBtc only goes
 * down, and only through {@link #consume(BigDecimal)}, which refuses to take
 * it below zero. Equality covers the fixed fields only.
 *
 * Basis leaves the lot rounded on the cumulative BTC taken, never per
 * disposal, so the disposals of a drained lot add up to its basis exactly.
 */
@Getter
@ToString
@EqualsAndHashCode
public class BitcoinLot {

    /**
     * FIFO order: oldest acquisition first, then creating transaction, then id.
     */
    public static final Comparator<BitcoinLot> FIFO_ORDER =
        Comparator.comparing(BitcoinLot::getAcquiredDate)
            .thenComparing(BitcoinLot::getCreatedTxnId)
            .thenComparing(BitcoinLot::getId);

    private final Long id;
    private final Long createdTxnId;
    private final Instant acquiredDate;
    private final BigDecimal totalBtc;
    private final BigDecimal costBasisUsd;
    @EqualsAndHashCode.Exclude
    private BigDecimal remainingBtc;

    public BitcoinLot(Long id, Long createdTxnId, Instant acquiredDate,
                      BigDecimal totalBtc, BigDecimal remainingBtc, BigDecimal costBasisUsd) {
        if (totalBtc.signum() <= 0) {
            throw new IllegalArgumentException("Lot size must be positive: " + totalBtc);
        }
        if (remainingBtc.signum() < 0 || remainingBtc.compareTo(totalBtc) > 0) {
            throw new IllegalArgumentException(String.format(
                "Remaining %s is outside [0, %s] for lot %s", remainingBtc, totalBtc, id));
        }
        this.id = id;
        this.createdTxnId = createdTxnId;
        this.acquiredDate = acquiredDate;
        this.totalBtc = totalBtc;
        this.remainingBtc = remainingBtc;
        this.costBasisUsd = costBasisUsd;
    }

    /**
     * A fresh lot with everything still remaining.
     */
    public static BitcoinLot open(Long id, Long createdTxnId, Instant acquiredDate,
                                  BigDecimal totalBtc, BigDecimal costBasisUsd) {
        return new BitcoinLot(id, createdTxnId, acquiredDate, totalBtc, totalBtc, costBasisUsd);
    }

    public boolean isOpen() {
        return remainingBtc.signum() > 0;
    }

    void consume(BigDecimal btc) {
        BigDecimal left = remainingBtc.subtract(btc);
        if (btc.signum() <= 0 || left.signum() < 0) {
            throw new IllegalStateException(String.format(
                "Cannot consume %s BTC from lot %s with %s remaining", btc, id, remainingBtc));
        }
        this.remainingBtc = left;
    }

    /**
     * Basis already carried out by disposals.
     */
    public BigDecimal disposedCostBasisUsd() {
        return costBasisUsd.multiply(totalBtc.subtract(remainingBtc))
            .divide(totalBtc, CurrencyCode.USD.getScale(), CurrencyCode.ROUNDING);
    }

    /**
     * Cost basis of what is still held: the lot's basis less what disposals
     * have carried out.
     */
    public BigDecimal remainingCostBasisUsd() {
        return CurrencyCode.USD.round(costBasisUsd).subtract(disposedCostBasisUsd());
    }

    public BitcoinLot copy() {
        return new BitcoinLot(id, createdTxnId, acquiredDate, totalBtc, remainingBtc, costBasisUsd);
    }
}
