package com.flagship.btc_ledger.transaction;

import com.flagship.btc_ledger.exception.TransactionNotFoundException;
import com.flagship.btc_ledger.transaction.command.TransactionCommand;
import com.flagship.btc_ledger.transaction.dto.LockRequest;
import com.flagship.btc_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for transactions.
 *
 * POST accepts an optional Idempotency-Key header: a repeated key returns the
 * original transaction with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransactionService transactionService;

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(
            @Valid @RequestBody TransactionCommand command,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received {} request: idempotencyKey={}", command.transactionType(), idempotencyKey);

        TransactionService.CreateResult result = transactionService.create(command, idempotencyKey);
        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(TransactionResponse.from(result.getTransaction()));
    }

    @GetMapping
    public List<TransactionResponse> listTransactions() {
        return transactionService.list().stream().map(TransactionResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") Long id) {
        return transactionService.findById(id)
            .map(transaction -> ResponseEntity.ok(TransactionResponse.from(transaction)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public TransactionResponse updateTransaction(@PathVariable("id") Long id,
                                                 @Valid @RequestBody TransactionCommand command) {
        return TransactionResponse.from(transactionService.update(id, command));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTransaction(@PathVariable("id") Long id) {
        transactionService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/lock")
    public TransactionResponse lockTransaction(@PathVariable("id") Long id,
                                               @Valid @RequestBody LockRequest request) {
        return TransactionResponse.from(transactionService.setLocked(id, request.getLocked()));
    }
}
