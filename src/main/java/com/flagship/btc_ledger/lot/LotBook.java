package com.flagship.btc_ledger.lot;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * The user's lots in FIFO order. Lots are global to the user, not to an
 * account, so a transfer between wallets never touches the book.
 */
public class LotBook {

    private final NavigableSet<BitcoinLot> lots = new TreeSet<>(BitcoinLot.FIFO_ORDER);

    public LotBook() {
    }

    public LotBook(Collection<BitcoinLot> seed) {
        seed.forEach(this::add);
    }

    public void add(BitcoinLot lot) {
        if (!lots.add(lot)) {
            throw new IllegalArgumentException("Lot already in book: " + lot.getId());
        }
    }

    public List<BitcoinLot> openLots() {
        return lots.stream().filter(BitcoinLot::isOpen).toList();
    }

    public List<BitcoinLot> allLots() {
        return new ArrayList<>(lots);
    }

    public BigDecimal openBtc() {
        return lots.stream()
            .map(BitcoinLot::getRemainingBtc)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int size() {
        return lots.size();
    }
}
