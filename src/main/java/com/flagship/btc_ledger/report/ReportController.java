package com.flagship.btc_ledger.report;

import com.flagship.btc_ledger.lot.DisposalFilter;
import com.flagship.btc_ledger.lot.HoldingPeriod;
import com.flagship.btc_ledger.report.dto.AverageCostBasisResponse;
import com.flagship.btc_ledger.report.dto.BalanceResponse;
import com.flagship.btc_ledger.report.dto.DisposalResponse;
import com.flagship.btc_ledger.report.dto.LotResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Balances, disposals, open lots and gains. Everything here is derived from
 * the last committed replay and never changes state.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final LedgerQueryService queryService;
    private final GainsSummaryService gainsSummaryService;

    @GetMapping("/balances")
    public List<BalanceResponse> getBalances() {
        return queryService.getAllBalances().stream().map(BalanceResponse::from).toList();
    }

    @GetMapping("/balances/{accountId}")
    public BalanceResponse getBalance(@PathVariable("accountId") int accountId) {
        return BalanceResponse.from(queryService.getBalance(accountId));
    }

    @GetMapping("/disposals")
    public List<DisposalResponse> getDisposals(
            @RequestParam(value = "from", required = false) Instant from,
            @RequestParam(value = "to", required = false) Instant to,
            @RequestParam(value = "holdingPeriod", required = false) HoldingPeriod holdingPeriod,
            @RequestParam(value = "reportableOnly", defaultValue = "false") boolean reportableOnly) {

        DisposalFilter filter = DisposalFilter.builder()
            .from(from)
            .to(to)
            .holdingPeriod(holdingPeriod)
            .reportableOnly(reportableOnly)
            .build();
        return queryService.findDisposals(filter).stream().map(DisposalResponse::from).toList();
    }

    @GetMapping("/lots/open")
    public List<LotResponse> getOpenLots(@RequestParam(value = "asOf", required = false) Instant asOf) {
        return queryService.getOpenLots(asOf).stream().map(LotResponse::from).toList();
    }

    @GetMapping("/average-cost-basis")
    public AverageCostBasisResponse getAverageCostBasis() {
        return queryService.getAverageCostBasis();
    }

    @GetMapping("/gains-summary")
    public GainsSummary getGainsSummary(@RequestParam(value = "year", required = false) Integer year) {
        return gainsSummaryService.getSummary(year);
    }
}
