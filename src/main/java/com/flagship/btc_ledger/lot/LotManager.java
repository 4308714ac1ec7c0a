package com.flagship.btc_ledger.lot;

import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Creates acquisition lots.
 *
 * Exactly one lot per Deposit or Buy that lands BTC in a holding account.
 * Transfers never create lots, so a lot keeps its acquisition date when its
 * coins move between wallets.
 */
@RequiredArgsConstructor
public class LotManager {

    private final TaxPolicy taxPolicy;

    public boolean createsLot(LedgerTransaction transaction) {
        TransactionType type = transaction.getType();
        return (type == TransactionType.DEPOSIT || type == TransactionType.BUY)
            && AccountDirectory.isBtcHolding(transaction.getToAccountId());
    }

    /**
     * Opens the lot for an acquiring transaction and adds it to the book.
     *
     * @return the new lot, or empty if the transaction does not acquire BTC
     */
    public Optional<BitcoinLot> acquire(LedgerTransaction transaction, LotBook book, LongSupplier lotIds) {
        if (!createsLot(transaction)) {
            return Optional.empty();
        }
        BitcoinLot lot = BitcoinLot.open(
            lotIds.getAsLong(),
            transaction.getId(),
            transaction.getTimestamp(),
            transaction.getAmount(),
            costBasisOf(transaction));
        book.add(lot);
        return Optional.of(lot);
    }

    BigDecimal costBasisOf(LedgerTransaction transaction) {
        BigDecimal basis = transaction.costBasisOrZero();
        if (transaction.getType() == TransactionType.BUY && taxPolicy.isCapitalizeTradeFees()) {
            basis = basis.add(transaction.feeIn(CurrencyCode.USD));
        }
        return CurrencyCode.USD.round(basis);
    }
}
