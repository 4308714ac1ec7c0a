package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.exception.InsufficientBitcoinException;
import com.flagship.btc_ledger.ledger.LedgerEntry;
import com.flagship.btc_ledger.ledger.LedgerService;
import com.flagship.btc_ledger.lot.BitcoinLot;
import com.flagship.btc_ledger.lot.DisposalFilter;
import com.flagship.btc_ledger.lot.LotDisposal;
import com.flagship.btc_ledger.lot.LotRepository;
import com.flagship.btc_ledger.observability.LedgerHealthIndicator;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionService;
import com.flagship.btc_ledger.transaction.command.BuyCommand;
import com.flagship.btc_ledger.transaction.command.SellCommand;
import com.flagship.btc_ledger.transaction.command.TransactionCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.flagship.btc_ledger.TestTransactions.day;
import static com.flagship.btc_ledger.TestTransactions.lotStates;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end write paths against Postgres: every mutation either commits a
 * fully rebuilt ledger or leaves the previous one untouched.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerRecalculationIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("btc_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private RecalculationService recalculationService;

    @Autowired
    private LedgerWriteCoordinator writeCoordinator;

    @Autowired
    private LotRepository lotRepository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private LedgerHealthIndicator healthIndicator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM lot_disposals");
        jdbcTemplate.update("DELETE FROM ledger_entries");
        jdbcTemplate.update("DELETE FROM bitcoin_lots");
        jdbcTemplate.update("DELETE FROM transactions");
    }

    private static BuyCommand buy(String date, String amount, String cost) {
        return BuyCommand.builder()
            .timestamp(day(date))
            .fromAccountId(AccountDirectory.BANK)
            .amount(new BigDecimal(amount))
            .costBasisUsd(new BigDecimal(cost))
            .build();
    }

    private static SellCommand sell(String date, String amount, String proceeds) {
        return SellCommand.builder()
            .timestamp(day(date))
            .amount(new BigDecimal(amount))
            .proceedsUsd(new BigDecimal(proceeds))
            .build();
    }

    private LedgerTransaction create(TransactionCommand command) {
        return transactionService.create(command, null).getTransaction();
    }

    private BigDecimal exchangeBtc() {
        return ledgerService.getAccountBalance(AccountDirectory.EXCHANGE_BTC).getBalance();
    }

    @Test
    @DisplayName("A backdated buy reshuffles FIFO for later sells")
    void testBackdatedBuy() {
        create(buy("2024-02-01", "1", "40000"));
        LedgerTransaction sale = create(sell("2024-03-01", "1", "50000"));
        assertEquals(0, new BigDecimal("10000").compareTo(
            transactionService.findById(sale.getId()).orElseThrow().getRealizedGainUsd()));

        create(buy("2024-01-15", "1", "20000"));

        LedgerTransaction resold = transactionService.findById(sale.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("30000").compareTo(resold.getRealizedGainUsd()));
        assertEquals(0, BigDecimal.ONE.compareTo(exchangeBtc()));
        assertEquals(Status.UP, healthIndicator.health().getStatus());
    }

    @Test
    @DisplayName("A stored sell keeps its entered proceeds and the realized proceeds beside them")
    void testStoredRollUp() {
        create(buy("2024-01-01", "1", "40000"));
        LedgerTransaction sale = create(SellCommand.builder()
            .timestamp(day("2024-02-01"))
            .amount(BigDecimal.ONE)
            .proceedsUsd(new BigDecimal("60000"))
            .feeAmount(new BigDecimal("100"))
            .build());

        writeCoordinator.write(recalculationService::recalculateAll);

        LedgerTransaction stored = transactionService.findById(sale.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("60000").compareTo(stored.getProceedsUsd()));
        assertEquals(0, new BigDecimal("59900").compareTo(stored.getRealizedProceedsUsd()));
        assertEquals(0, new BigDecimal("40000").compareTo(stored.getCostBasisUsd()));
        assertEquals(0, new BigDecimal("19900").compareTo(stored.getRealizedGainUsd()));
    }

    @Test
    @DisplayName("A sell without enough BTC commits nothing")
    void testInfeasibleCreateRollsBack() {
        create(buy("2024-01-01", "0.5", "15000"));
        List<List<Object>> lotsBefore = lotStates(lotRepository.findAllLots());

        InsufficientBitcoinException e = assertThrows(InsufficientBitcoinException.class,
            () -> create(sell("2024-02-01", "1", "50000")));

        assertEquals(0, BigDecimal.ONE.compareTo(e.getRequired()));
        assertEquals(1, transactionService.list().size());
        assertEquals(lotsBefore, lotStates(lotRepository.findAllLots()));
        assertTrue(lotRepository.findDisposals(DisposalFilter.all()).isEmpty());
    }

    @Test
    @DisplayName("Deleting the buy a later sell depends on is rejected and rolled back")
    void testInfeasibleDeleteRollsBack() {
        LedgerTransaction acquisition = create(buy("2024-01-01", "1", "20000"));
        create(sell("2024-02-01", "1", "30000"));
        List<LedgerEntry> entriesBefore = ledgerService.getAllEntries();

        assertThrows(InsufficientBitcoinException.class, () -> transactionService.delete(acquisition.getId()));

        assertTrue(transactionService.findById(acquisition.getId()).isPresent());
        assertEquals(entriesBefore, ledgerService.getAllEntries());
        assertEquals(1, lotRepository.findDisposals(DisposalFilter.all()).size());
    }

    @Test
    @DisplayName("Editing a buy below what was later sold is rejected and rolled back")
    void testInfeasibleUpdateRollsBack() {
        LedgerTransaction acquisition = create(buy("2024-01-01", "1", "20000"));
        create(sell("2024-02-01", "0.8", "30000"));

        assertThrows(InsufficientBitcoinException.class,
            () -> transactionService.update(acquisition.getId(), buy("2024-01-01", "0.5", "10000")));

        LedgerTransaction unchanged = transactionService.findById(acquisition.getId()).orElseThrow();
        assertEquals(0, BigDecimal.ONE.compareTo(unchanged.getAmount()));
        assertEquals(0, new BigDecimal("0.2").compareTo(exchangeBtc()));
    }

    @Test
    @DisplayName("Partial replay from a cutoff stores exactly what a full replay stores")
    void testPartialReplayMatchesFull() {
        create(buy("2024-01-01", "1", "20000"));
        create(buy("2024-02-01", "0.5", "15000"));
        create(sell("2024-03-01", "0.7", "35000"));
        create(buy("2024-04-01", "0.25", "10000"));
        create(sell("2024-05-01", "0.5", "30000"));

        writeCoordinator.write(() -> recalculationService.recalculateFrom(day("2024-03-01")));
        List<List<Object>> partialLots = lotStates(lotRepository.findAllLots());
        List<LotDisposal> partialDisposals = lotRepository.findDisposals(DisposalFilter.all());
        List<LedgerEntry> partialEntries = ledgerService.getAllEntries();

        writeCoordinator.write(recalculationService::recalculateAll);

        assertEquals(lotStates(lotRepository.findAllLots()), partialLots);
        assertEquals(lotRepository.findDisposals(DisposalFilter.all()), partialDisposals);
        assertEquals(ledgerService.getAllEntries(), partialEntries);
        assertEquals(Status.UP, healthIndicator.health().getStatus());
    }

    @Test
    @DisplayName("As-of open lots ignore everything from the instant on")
    void testOpenLotsAsOf() {
        create(buy("2024-01-01", "1", "20000"));
        create(sell("2024-03-01", "1", "30000"));

        List<BitcoinLot> before = recalculationService.openLotsAsOf(day("2024-02-01"));
        assertEquals(1, before.size());
        assertEquals(0, BigDecimal.ONE.compareTo(before.get(0).getRemainingBtc()));
        assertTrue(recalculationService.openLotsAsOf(Instant.parse("2024-03-02T00:00:00Z")).isEmpty());
        assertTrue(lotRepository.findOpenLots().isEmpty());
    }

    @Test
    @DisplayName("An idempotency key records the transaction once")
    void testIdempotencyKey() {
        TransactionService.CreateResult first = transactionService.create(buy("2024-01-01", "1", "20000"), "buy-1");
        TransactionService.CreateResult second = transactionService.create(buy("2024-01-01", "1", "20000"), "buy-1");

        assertTrue(first.isCreated());
        assertFalse(second.isCreated());
        assertEquals(first.getTransaction().getId(), second.getTransaction().getId());
        assertEquals(1, transactionService.list().size());
        assertEquals(1, lotRepository.findAllLots().size());
    }

    @Test
    @DisplayName("Locked transactions refuse edits and deletes but still replay")
    void testLockedTransaction() {
        LedgerTransaction acquisition = create(buy("2024-01-01", "1", "20000"));
        transactionService.setLocked(acquisition.getId(), true);

        assertThrows(IllegalStateException.class,
            () -> transactionService.update(acquisition.getId(), buy("2024-01-01", "2", "40000")));
        assertThrows(IllegalStateException.class, () -> transactionService.delete(acquisition.getId()));

        create(buy("2023-12-01", "0.5", "10000"));
        assertEquals(0, new BigDecimal("1.5").compareTo(exchangeBtc()));

        transactionService.setLocked(acquisition.getId(), false);
        transactionService.delete(acquisition.getId());
        assertEquals(0, new BigDecimal("0.5").compareTo(exchangeBtc()));
    }
}
