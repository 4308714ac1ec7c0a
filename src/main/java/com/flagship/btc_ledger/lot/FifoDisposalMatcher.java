package com.flagship.btc_ledger.lot;

import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.exception.InsufficientBitcoinException;
import com.flagship.btc_ledger.recalc.ReplayStage;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionPurpose;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Matches BTC-disposing transactions against open lots, oldest first.
 *
 * Disposing transactions:
 * - SELL: the traded amount; proceeds net of the USD trade fee, never below zero
 * - WITHDRAWAL from a BTC account: amount plus the BTC fee; gift-type purposes
 *   consume lots without proceeds or gain
 * - TRANSFER with a BTC fee: only the fee leaves the user's hands
 *
 * Each fragment's basis is the lot's basis pro-rated by the BTC taken, and its
 * proceeds are the transaction's proceeds pro-rated by its share of the total.
 * Both are rounded on running totals and taken as differences: the fragments
 * of a transaction add up to its proceeds, and the disposals of a drained lot
 * add up to the lot's basis, to the cent.
 */
@RequiredArgsConstructor
@Slf4j
public class FifoDisposalMatcher {

    private final TaxPolicy taxPolicy;

    public Optional<DisposalRequest> requestFor(LedgerTransaction transaction) {
        return switch (transaction.getType()) {
            case SELL -> Optional.of(sellRequest(transaction));
            case WITHDRAWAL -> withdrawalRequest(transaction);
            case TRANSFER -> transferFeeRequest(transaction);
            case DEPOSIT, BUY -> Optional.empty();
        };
    }

    private DisposalRequest sellRequest(LedgerTransaction transaction) {
        BigDecimal proceeds = transaction.proceedsOrZero();
        if (taxPolicy.isCapitalizeTradeFees()) {
            proceeds = proceeds.subtract(transaction.feeIn(CurrencyCode.USD)).max(BigDecimal.ZERO);
        }
        return new DisposalRequest(transaction.getAmount(), proceeds, DisposalKind.SELL, true);
    }

    private Optional<DisposalRequest> withdrawalRequest(LedgerTransaction transaction) {
        if (!AccountDirectory.isBtcHolding(transaction.getFromAccountId())) {
            return Optional.empty();
        }
        BigDecimal required = transaction.getAmount().add(transaction.feeIn(CurrencyCode.BTC));
        TransactionPurpose purpose = transaction.purposeOrDefault();
        if (purpose.isGiftLike()) {
            return Optional.of(new DisposalRequest(required, BigDecimal.ZERO, DisposalKind.GIFT, false));
        }
        return Optional.of(new DisposalRequest(
            required, transaction.proceedsOrZero(), DisposalKind.WITHDRAWAL, true));
    }

    private Optional<DisposalRequest> transferFeeRequest(LedgerTransaction transaction) {
        BigDecimal fee = transaction.feeIn(CurrencyCode.BTC);
        if (fee.signum() == 0 || !AccountDirectory.isBtcHolding(transaction.getFromAccountId())) {
            return Optional.empty();
        }
        boolean taxable = taxPolicy.isTransferFeeTaxable();
        BigDecimal proceeds = taxable ? transaction.fmvOrZero() : BigDecimal.ZERO;
        return Optional.of(new DisposalRequest(fee, proceeds, DisposalKind.TRANSFER_FEE, taxable));
    }

    /**
     * Consumes lots for a disposing transaction.
     *
     * Feasibility is checked before any lot is touched, so a failed match
     * leaves the book exactly as it was.
     *
     * @return the fragments in FIFO order, empty if the transaction disposes nothing
     * @throws InsufficientBitcoinException if the open lots hold less than required
     */
    public List<LotDisposal> dispose(LedgerTransaction transaction, LotBook book, LongSupplier disposalIds) {
        Optional<DisposalRequest> maybeRequest = requestFor(transaction);
        if (maybeRequest.isEmpty()) {
            return List.of();
        }
        DisposalRequest request = maybeRequest.get();
        BigDecimal required = request.getRequiredBtc();

        BigDecimal available = book.openBtc();
        if (available.compareTo(required) < 0) {
            throw new InsufficientBitcoinException(transaction.getId(), ReplayStage.POSTED, required, available);
        }

        List<LotDisposal> fragments = new ArrayList<>();
        BigDecimal taken = BigDecimal.ZERO;
        for (BitcoinLot lot : book.openLots()) {
            if (taken.compareTo(required) == 0) {
                break;
            }
            BigDecimal consumed = required.subtract(taken).min(lot.getRemainingBtc());

            BigDecimal basisBefore = lot.disposedCostBasisUsd();
            lot.consume(consumed);
            BigDecimal basis = lot.disposedCostBasisUsd().subtract(basisBefore);

            BigDecimal proceedsBefore = proceedsThrough(request, taken);
            taken = taken.add(consumed);
            BigDecimal proceeds = proceedsThrough(request, taken).subtract(proceedsBefore);

            fragments.add(fragment(transaction, request, lot, consumed, basis, proceeds, disposalIds.getAsLong()));
        }

        log.debug("Matched {} BTC across {} lots for transaction {}",
            required.toPlainString(), fragments.size(), transaction.getId());
        return fragments;
    }

    /**
     * The transaction's proceeds attributable to the first {@code taken} BTC.
     */
    private static BigDecimal proceedsThrough(DisposalRequest request, BigDecimal taken) {
        return request.getProceedsUsd()
            .multiply(taken)
            .divide(request.getRequiredBtc(), CurrencyCode.USD.getScale(), CurrencyCode.ROUNDING);
    }

    private LotDisposal fragment(LedgerTransaction transaction, DisposalRequest request, BitcoinLot lot,
                                 BigDecimal consumed, BigDecimal basis, BigDecimal proceeds, long id) {
        BigDecimal gain = request.isReportable()
            ? proceeds.subtract(basis)
            : BigDecimal.ZERO.setScale(CurrencyCode.USD.getScale());

        return LotDisposal.builder()
            .id(id)
            .lotId(lot.getId())
            .transactionId(transaction.getId())
            .disposedAt(transaction.getTimestamp())
            .disposedBtc(consumed)
            .disposalBasisUsd(basis)
            .proceedsUsd(proceeds)
            .realizedGainUsd(gain)
            .holdingPeriod(taxPolicy.classify(lot.getAcquiredDate(), transaction.getTimestamp()))
            .kind(request.getKind())
            .reportable(request.isReportable())
            .build();
    }
}
