package com.flagship.btc_ledger.report;

import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.ledger.AccountBalance;
import com.flagship.btc_ledger.ledger.LedgerEntry;
import com.flagship.btc_ledger.ledger.LedgerService;
import com.flagship.btc_ledger.lot.BitcoinLot;
import com.flagship.btc_ledger.lot.DisposalFilter;
import com.flagship.btc_ledger.lot.LotDisposal;
import com.flagship.btc_ledger.lot.LotRepository;
import com.flagship.btc_ledger.recalc.RecalculationService;
import com.flagship.btc_ledger.report.dto.AverageCostBasisResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only views over the derived ledger state.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class LedgerQueryService {

    private final LedgerService ledgerService;
    private final LotRepository lotRepository;
    private final RecalculationService recalculationService;

    public List<AccountBalance> getAllBalances() {
        return ledgerService.getAllBalances();
    }

    public AccountBalance getBalance(int accountId) {
        return ledgerService.getAccountBalance(accountId);
    }

    public List<LotDisposal> findDisposals(DisposalFilter filter) {
        if (filter.getFrom() != null && filter.getTo() != null && !filter.getFrom().isBefore(filter.getTo())) {
            throw new IllegalArgumentException("'from' must be before 'to'");
        }
        return lotRepository.findDisposals(filter);
    }

    /**
     * Open lots in FIFO order. With an instant, the lots that were open just
     * before it, rebuilt in memory from the history that precedes it.
     */
    public List<BitcoinLot> getOpenLots(Instant asOf) {
        return asOf == null ? lotRepository.findOpenLots() : recalculationService.openLotsAsOf(asOf);
    }

    public List<BitcoinLot> getAllLots() {
        return lotRepository.findAllLots();
    }

    public Optional<BitcoinLot> findLot(long lotId) {
        return lotRepository.findLot(lotId);
    }

    public List<LotDisposal> getDisposalsForLot(long lotId) {
        return lotRepository.findDisposalsForLot(lotId);
    }

    public List<LedgerEntry> getAllEntries() {
        return ledgerService.getAllEntries();
    }

    public List<LedgerEntry> getEntriesForTransaction(Long transactionId) {
        return ledgerService.getLedgerEntriesForTransaction(transactionId);
    }

    /**
     * Average USD cost per BTC still held: remaining basis over remaining BTC,
     * rounded to cents. Zero when nothing is held.
     */
    public AverageCostBasisResponse getAverageCostBasis() {
        return averageOf(lotRepository.findOpenLots());
    }

    static AverageCostBasisResponse averageOf(List<BitcoinLot> openLots) {
        BigDecimal btcHeld = BigDecimal.ZERO;
        BigDecimal remainingBasis = BigDecimal.ZERO;
        for (BitcoinLot lot : openLots) {
            btcHeld = btcHeld.add(lot.getRemainingBtc());
            remainingBasis = remainingBasis.add(lot.remainingCostBasisUsd());
        }

        BigDecimal average = btcHeld.signum() == 0
            ? CurrencyCode.USD.round(BigDecimal.ZERO)
            : remainingBasis.divide(btcHeld, CurrencyCode.USD.getScale(), CurrencyCode.ROUNDING);

        return AverageCostBasisResponse.builder()
            .averageCostBasisUsd(average)
            .btcHeld(CurrencyCode.BTC.round(btcHeld))
            .remainingCostBasisUsd(CurrencyCode.USD.round(remainingBasis))
            .build();
    }
}
