package com.flagship.btc_ledger.report;

import com.flagship.btc_ledger.lot.DisposalFilter;
import com.flagship.btc_ledger.lot.LotRepository;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionEntity;
import com.flagship.btc_ledger.transaction.TransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@Slf4j
public class GainsSummaryService {

    private static final int FIRST_YEAR = 2009;
    private static final int LAST_YEAR = 9999;

    private final TransactionRepository transactionRepository;
    private final LotRepository lotRepository;
    private final GainsSummaryCalculator calculator;

    public GainsSummaryService(TransactionRepository transactionRepository,
                               LotRepository lotRepository,
                               Clock clock) {
        this.transactionRepository = transactionRepository;
        this.lotRepository = lotRepository;
        this.calculator = new GainsSummaryCalculator(clock);
    }

    /**
     * @param year calendar year, or null for all time
     * @throws IllegalArgumentException if the year is out of range
     */
    @Transactional(readOnly = true)
    public GainsSummary getSummary(Integer year) {
        if (year != null && (year < FIRST_YEAR || year > LAST_YEAR)) {
            throw new IllegalArgumentException("Year must be between " + FIRST_YEAR + " and " + LAST_YEAR);
        }
        List<LedgerTransaction> transactions = transactionRepository.findAllByOrderByOccurredAtAscIdAsc().stream()
            .map(TransactionEntity::toDomain)
            .toList();

        GainsSummary summary = calculator.summarize(transactions, lotRepository.findDisposals(DisposalFilter.all()), year);
        log.debug("Gains summary for {}: net={}", year == null ? "all time" : year, summary.getTotalNetCapitalGains());
        return summary;
    }
}
