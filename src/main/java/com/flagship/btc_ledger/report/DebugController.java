package com.flagship.btc_ledger.report;

import com.flagship.btc_ledger.lot.DisposalFilter;
import com.flagship.btc_ledger.recalc.LedgerWriteCoordinator;
import com.flagship.btc_ledger.recalc.RecalculationService;
import com.flagship.btc_ledger.report.dto.DisposalResponse;
import com.flagship.btc_ledger.report.dto.LedgerEntryResponse;
import com.flagship.btc_ledger.report.dto.LotDetailResponse;
import com.flagship.btc_ledger.report.dto.LotResponse;
import com.flagship.btc_ledger.report.dto.RecalculationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Raw derived rows for inspection, plus a forced full rebuild.
 */
@RestController
@RequestMapping("/api/debug")
@RequiredArgsConstructor
@Slf4j
public class DebugController {

    private final LedgerQueryService queryService;
    private final RecalculationService recalculationService;
    private final LedgerWriteCoordinator writeCoordinator;

    @GetMapping("/lots")
    public List<LotResponse> getLots() {
        return queryService.getAllLots().stream().map(LotResponse::from).toList();
    }

    @GetMapping("/lots/{id}")
    public ResponseEntity<LotDetailResponse> getLot(@PathVariable("id") long id) {
        return queryService.findLot(id)
            .map(lot -> ResponseEntity.ok(LotDetailResponse.builder()
                .lot(LotResponse.from(lot))
                .disposals(queryService.getDisposalsForLot(id).stream().map(DisposalResponse::from).toList())
                .build()))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/disposals")
    public List<DisposalResponse> getDisposals() {
        return queryService.findDisposals(DisposalFilter.all()).stream().map(DisposalResponse::from).toList();
    }

    @GetMapping("/ledger-entries")
    public List<LedgerEntryResponse> getLedgerEntries() {
        return queryService.getAllEntries().stream().map(LedgerEntryResponse::from).toList();
    }

    @GetMapping("/transactions/{id}/ledger-entries")
    public List<LedgerEntryResponse> getTransactionEntries(@PathVariable("id") Long id) {
        return queryService.getEntriesForTransaction(id).stream().map(LedgerEntryResponse::from).toList();
    }

    @PostMapping("/recalculate")
    public RecalculationResponse recalculate() {
        log.info("Forced full recalculation requested");
        return RecalculationResponse.from(writeCoordinator.write(recalculationService::recalculateAll));
    }
}
