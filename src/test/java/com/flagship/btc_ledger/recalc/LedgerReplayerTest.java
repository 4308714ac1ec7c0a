package com.flagship.btc_ledger.recalc;

import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.exception.InsufficientBitcoinException;
import com.flagship.btc_ledger.ledger.LedgerEntry;
import com.flagship.btc_ledger.lot.BitcoinLot;
import com.flagship.btc_ledger.lot.DisposalKind;
import com.flagship.btc_ledger.lot.HoldingPeriod;
import com.flagship.btc_ledger.lot.LotDisposal;
import com.flagship.btc_ledger.lot.TaxPolicy;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionPurpose;
import com.flagship.btc_ledger.transaction.TransactionSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.flagship.btc_ledger.TestTransactions.btcDeposit;
import static com.flagship.btc_ledger.TestTransactions.btcTransfer;
import static com.flagship.btc_ledger.TestTransactions.btcWithdrawal;
import static com.flagship.btc_ledger.TestTransactions.buy;
import static com.flagship.btc_ledger.TestTransactions.day;
import static com.flagship.btc_ledger.TestTransactions.lotStates;
import static com.flagship.btc_ledger.TestTransactions.sameAmount;
import static com.flagship.btc_ledger.TestTransactions.sell;
import static com.flagship.btc_ledger.TestTransactions.usdDeposit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Replays whole histories in memory and checks the derived lots,
 * disposals and postings.
 */
class LedgerReplayerTest {

    private final LedgerReplayer replayer = new LedgerReplayer(TaxPolicy.defaults());

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static List<LedgerTransaction> fifoHistory() {
        return List.of(
            buy(1, "2024-02-01", "1", "40000"),
            buy(2, "2024-03-01", "1", "50000"),
            sell(3, "2024-04-01", "1", "60000"));
    }

    @Test
    @DisplayName("Sell consumes the oldest lot first")
    void testFifoBasic() {
        printTestHeader("FIFO Basic");

        List<LedgerTransaction> history = fifoHistory();
        printInput("History", "Buy 1 @ 40k (Feb), Buy 1 @ 50k (Mar), Sell 1 for 60k (Apr)");

        ReplayResult result = replayer.replay(history);

        assertEquals(1, result.getDisposals().size(), "One lot should cover the whole sell");
        LotDisposal disposal = result.getDisposals().get(0);
        printOutput("Disposal", disposal);

        assertEquals(1L, disposal.getLotId(), "The February lot is consumed");
        assertTrue(sameAmount("40000.00", disposal.getDisposalBasisUsd()));
        assertTrue(sameAmount("60000.00", disposal.getProceedsUsd()));
        assertTrue(sameAmount("20000.00", disposal.getRealizedGainUsd()));
        assertEquals(HoldingPeriod.SHORT, disposal.getHoldingPeriod());
        assertEquals(DisposalKind.SELL, disposal.getKind());
        assertTrue(disposal.isReportable());

        TransactionOutcome outcome = result.outcomesById().get(3L);
        assertTrue(outcome.isDisposing());
        assertTrue(sameAmount("40000.00", outcome.getCostBasisUsd()));
        assertTrue(sameAmount("20000.00", outcome.getRealizedGainUsd()));
        assertEquals(HoldingPeriod.SHORT, outcome.getHoldingPeriod());

        List<BitcoinLot> open = result.openLots();
        assertEquals(1, open.size());
        assertEquals(2L, open.get(0).getCreatedTxnId(), "Only the March lot stays open");
        printSuccess("Oldest lot matched, gain 20,000 short term");
    }

    @Test
    @DisplayName("A backdated buy takes over the sell's basis")
    void testBackdatedReshuffle() {
        printTestHeader("Backdated Reshuffle");

        List<LedgerTransaction> history = new ArrayList<>(fifoHistory());
        history.add(buy(4, "2024-01-15", "1", "30000"));
        printInput("Backdated", "Buy 1 @ 30k dated 2024-01-15, submitted last");

        ReplayResult result = replayer.replay(history);

        LotDisposal disposal = result.getDisposals().get(0);
        printOutput("Disposal", disposal);

        assertEquals(1, result.getDisposals().size());
        assertTrue(sameAmount("30000.00", disposal.getDisposalBasisUsd()));
        assertTrue(sameAmount("30000.00", disposal.getRealizedGainUsd()));
        assertTrue(sameAmount("30000.00", result.outcomesById().get(3L).getCostBasisUsd()));

        BitcoinLot consumed = result.allLots().stream()
            .filter(lot -> lot.getId().equals(disposal.getLotId()))
            .findFirst()
            .orElseThrow();
        assertEquals(4L, consumed.getCreatedTxnId(), "The backdated lot is the oldest now");
        assertEquals(2, result.openLots().size());
        printSuccess("Backdated lot consumed first");
    }

    @Test
    @DisplayName("Submission order never changes the result")
    void testOrderIndependence() {
        printTestHeader("Order Independence");

        List<LedgerTransaction> chronological = List.of(
            buy(4, "2024-01-15", "1", "30000"),
            buy(1, "2024-02-01", "1", "40000"),
            buy(2, "2024-03-01", "1", "50000"),
            sell(3, "2024-04-01", "1", "60000"));
        List<LedgerTransaction> shuffled = List.of(
            chronological.get(3), chronological.get(0), chronological.get(2), chronological.get(1));

        ReplayResult first = replayer.replay(chronological);
        ReplayResult second = replayer.replay(shuffled);

        printOutput("Entries", first.getEntries().size());
        assertEquals(first, second, "Entries, lots, disposals and ids must all match");
        assertEquals(lotStates(first.allLots()), lotStates(second.allLots()));
        assertEquals(first, replayer.replay(chronological), "Replaying twice is deterministic");
        printSuccess("Identical results regardless of input order");
    }

    @Test
    @DisplayName("Partial lot split pro-rates basis")
    void testPartialLotSplit() {
        printTestHeader("Partial Lot Split");

        List<LedgerTransaction> history = List.of(
            btcDeposit(1, "2024-01-01", "1.0", "20000", TransactionSource.MY_BTC),
            sell(2, "2024-06-01", "0.3", "9000"));
        printInput("Lot", "1.0 BTC at 20,000");
        printInput("Disposal", "0.3 BTC for 9,000");

        ReplayResult result = replayer.replay(history);

        LotDisposal disposal = result.getDisposals().get(0);
        printOutput("Disposal", disposal);
        assertTrue(sameAmount("6000.00", disposal.getDisposalBasisUsd()));
        assertTrue(sameAmount("3000.00", disposal.getRealizedGainUsd()));
        assertEquals(2, disposal.getRealizedGainUsd().scale(), "Gains are kept in cents");

        BitcoinLot lot = result.allLots().get(0);
        assertTrue(sameAmount("0.7", lot.getRemainingBtc()));
        assertTrue(sameAmount("14000.00", lot.remainingCostBasisUsd()));
        printSuccess("Basis 6,000, gain 3,000, 0.7 BTC left");
    }

    @Test
    @DisplayName("A sell spanning two lots produces one fragment per lot")
    void testSellAcrossLots() {
        printTestHeader("Sell Across Lots");

        List<LedgerTransaction> history = List.of(
            buy(1, "2024-01-01", "0.5", "20000"),
            buy(2, "2024-02-01", "0.5", "30000"),
            sell(3, "2024-03-01", "0.8", "40000"));

        ReplayResult result = replayer.replay(history);
        List<LotDisposal> fragments = result.getDisposals();
        fragments.forEach(fragment -> printOutput("Fragment", fragment));

        assertEquals(2, fragments.size());
        assertTrue(sameAmount("0.5", fragments.get(0).getDisposedBtc()));
        assertTrue(sameAmount("20000.00", fragments.get(0).getDisposalBasisUsd()));
        assertTrue(sameAmount("25000.00", fragments.get(0).getProceedsUsd()));
        assertTrue(sameAmount("5000.00", fragments.get(0).getRealizedGainUsd()));

        assertTrue(sameAmount("0.3", fragments.get(1).getDisposedBtc()));
        assertTrue(sameAmount("18000.00", fragments.get(1).getDisposalBasisUsd()));
        assertTrue(sameAmount("15000.00", fragments.get(1).getProceedsUsd()));
        assertTrue(sameAmount("-3000.00", fragments.get(1).getRealizedGainUsd()));

        TransactionOutcome outcome = result.outcomesById().get(3L);
        assertTrue(sameAmount("38000.00", outcome.getCostBasisUsd()));
        assertTrue(sameAmount("40000.00", outcome.getRealizedProceedsUsd()));
        assertTrue(sameAmount("2000.00", outcome.getRealizedGainUsd()));
        printSuccess("Two fragments, net gain 2,000");
    }

    @Test
    @DisplayName("A sell's roll-up carries its proceeds net of the trade fee")
    void testRollUpCarriesProceeds() {
        printTestHeader("Roll-up Proceeds");

        LedgerTransaction sale = sell(2, "2024-04-01", "1", "60000", "100");
        List<LedgerTransaction> history = List.of(buy(1, "2024-02-01", "1", "40000"), sale);
        printInput("History", "Buy 1 @ 40k, Sell 1 for 60k with a $100 fee");

        ReplayResult result = replayer.replay(history);
        TransactionOutcome outcome = result.outcomesById().get(2L);
        printOutput("Outcome", outcome);

        assertTrue(sameAmount("40000.00", outcome.getCostBasisUsd()));
        assertTrue(sameAmount("59900.00", outcome.getRealizedProceedsUsd()));
        assertTrue(sameAmount("19900.00", outcome.getRealizedGainUsd()));
        assertEquals(0, outcome.getRealizedProceedsUsd().subtract(outcome.getCostBasisUsd())
            .compareTo(outcome.getRealizedGainUsd()), "Realized proceeds less basis is the gain");
        assertTrue(sameAmount("60000", sale.getProceedsUsd()), "Entered proceeds are an input");
        assertEquals(result, replayer.replay(history), "The fee is taken once, however often we replay");
        printSuccess("Proceeds 59,900 less basis 40,000 is the 19,900 gain");
    }

    @Test
    @DisplayName("A sell across equal lots keeps every cent of its proceeds")
    void testRollUpProceedsAcrossLots() {
        List<LedgerTransaction> history = List.of(
            buy(1, "2024-01-01", "1", "10"),
            buy(2, "2024-01-02", "1", "10"),
            buy(3, "2024-01-03", "1", "10"),
            sell(4, "2024-02-01", "3", "100"));

        ReplayResult result = replayer.replay(history);
        TransactionOutcome outcome = result.outcomesById().get(4L);

        assertEquals(3, result.getDisposals().size());
        assertTrue(sameAmount("100.00", outcome.getRealizedProceedsUsd()));
        assertTrue(sameAmount("30.00", outcome.getCostBasisUsd()));
        assertTrue(sameAmount("70.00", outcome.getRealizedGainUsd()));
    }

    @Test
    @DisplayName("Disposing more BTC than held fails without touching the seed lots")
    void testInsufficientFunds() {
        printTestHeader("Insufficient Funds");

        BitcoinLot seeded = BitcoinLot.open(1L, 1L, day("2024-01-01"), new BigDecimal("0.5"), new BigDecimal("10000"));
        ReplaySeed seed = new ReplaySeed(List.of(seeded), 3, 2, 1);
        printInput("Open", "0.5 BTC");
        printInput("Sell", "1.0 BTC");

        InsufficientBitcoinException exception = assertThrows(InsufficientBitcoinException.class,
            () -> replayer.replay(List.of(sell(2, "2024-02-01", "1.0", "50000")), seed));
        printOutput("Exception", exception.getMessage());

        assertEquals(2L, exception.getTransactionId());
        assertEquals(ReplayStage.POSTED, exception.getStage());
        assertTrue(sameAmount("1.0", exception.getRequired()));
        assertTrue(sameAmount("0.5", exception.getAvailable()));
        assertTrue(sameAmount("0.5", seeded.getRemainingBtc()), "Seed lots are never mutated");
        printSuccess("Rejected with nothing changed");
    }

    @Test
    @DisplayName("365 days is short term, 366 days is long term")
    void testHoldingPeriodBoundary() {
        printTestHeader("Holding Period Boundary");

        LedgerTransaction deposit = btcDeposit(1, "2023-01-01", "1", "10000", TransactionSource.MY_BTC);

        ReplayResult atYear = replayer.replay(List.of(deposit, sell(2, "2024-01-01", "0.1", "2000")));
        ReplayResult pastYear = replayer.replay(List.of(deposit, sell(2, "2024-01-02", "0.1", "2000")));

        printOutput("2024-01-01", atYear.getDisposals().get(0).getHoldingPeriod());
        printOutput("2024-01-02", pastYear.getDisposals().get(0).getHoldingPeriod());
        assertEquals(HoldingPeriod.SHORT, atYear.getDisposals().get(0).getHoldingPeriod());
        assertEquals(HoldingPeriod.LONG, pastYear.getDisposals().get(0).getHoldingPeriod());
        printSuccess("Boundary classified correctly");
    }

    @Test
    @DisplayName("BTC transfer fee is a small taxable disposal")
    void testTransferFee() {
        printTestHeader("Transfer Fee");

        List<LedgerTransaction> history = List.of(
            btcDeposit(1, "2024-01-01", "1.0", "30000", TransactionSource.MY_BTC),
            btcTransfer(2, "2024-02-01", AccountDirectory.WALLET, AccountDirectory.EXCHANGE_BTC,
                "0.5", "0.0001", "5"));

        ReplayResult result = replayer.replay(history);
        LotDisposal disposal = result.getDisposals().get(0);
        printOutput("Disposal", disposal);

        assertEquals(1, result.getDisposals().size());
        assertEquals(DisposalKind.TRANSFER_FEE, disposal.getKind());
        assertTrue(sameAmount("0.0001", disposal.getDisposedBtc()));
        assertTrue(sameAmount("3.00", disposal.getDisposalBasisUsd()));
        assertTrue(sameAmount("5.00", disposal.getProceedsUsd()));
        assertTrue(sameAmount("2.00", disposal.getRealizedGainUsd()));
        assertTrue(disposal.isReportable());
        assertTrue(sameAmount("0.9999", result.allLots().get(0).getRemainingBtc()));

        assertBtcReconciles(result);
        printSuccess("Only the fee left the user's hands");
    }

    @Test
    @DisplayName("Untaxed transfer fees still consume lots but report nothing")
    void testTransferFeeNotTaxable() {
        printTestHeader("Transfer Fee Not Taxable");

        LedgerReplayer untaxed = new LedgerReplayer(TaxPolicy.builder().transferFeeTaxable(false).build());
        ReplayResult result = untaxed.replay(List.of(
            btcDeposit(1, "2024-01-01", "1.0", "30000", TransactionSource.MY_BTC),
            btcTransfer(2, "2024-02-01", AccountDirectory.WALLET, AccountDirectory.EXCHANGE_BTC,
                "0.5", "0.0001", "5")));

        LotDisposal disposal = result.getDisposals().get(0);
        printOutput("Disposal", disposal);
        assertFalse(disposal.isReportable());
        assertTrue(sameAmount("0", disposal.getProceedsUsd()));
        assertTrue(sameAmount("0", disposal.getRealizedGainUsd()));
        assertTrue(sameAmount("0.9999", result.allLots().get(0).getRemainingBtc()));
        printSuccess("Fee consumed without a reportable gain");
    }

    @Test
    @DisplayName("Gift withdrawal consumes lots with zero gain")
    void testGiftWithdrawal() {
        printTestHeader("Gift Withdrawal");

        ReplayResult result = replayer.replay(List.of(
            btcDeposit(1, "2024-01-01", "1.0", "10000", TransactionSource.MY_BTC),
            btcWithdrawal(2, "2024-05-01", "0.4", "0.001", TransactionPurpose.GIFT, null)));

        LotDisposal disposal = result.getDisposals().get(0);
        printOutput("Disposal", disposal);

        assertEquals(DisposalKind.GIFT, disposal.getKind());
        assertFalse(disposal.isReportable());
        assertTrue(sameAmount("0.401", disposal.getDisposedBtc()), "Amount plus fee leaves the lots");
        assertTrue(sameAmount("4010.00", disposal.getDisposalBasisUsd()));
        assertTrue(sameAmount("0.00", disposal.getRealizedGainUsd()));

        TransactionOutcome outcome = result.outcomesById().get(2L);
        assertTrue(sameAmount("4010.00", outcome.getCostBasisUsd()));
        assertTrue(sameAmount("0.00", outcome.getRealizedGainUsd()));
        assertBtcReconciles(result);
        printSuccess("Gift carries basis but no gain");
    }

    @Test
    @DisplayName("Lots conserve BTC and ledger balances match open lots")
    void testConservationAndReconciliation() {
        printTestHeader("Conservation And Reconciliation");

        List<LedgerTransaction> history = List.of(
            usdDeposit(1, "2024-01-01", "100000"),
            buy(2, "2024-01-02", "0.75", "30000", "25"),
            btcDeposit(3, "2024-01-03", "0.25", "9000", TransactionSource.INCOME),
            btcTransfer(4, "2024-01-04", AccountDirectory.EXCHANGE_BTC, AccountDirectory.WALLET,
                "0.5", "0.0002", "8"),
            sell(5, "2024-02-01", "0.2", "9000", "10"),
            btcWithdrawal(6, "2024-03-01", "0.1", "0.0001", TransactionPurpose.SPENT, "4500"),
            btcWithdrawal(7, "2024-03-02", "0.05", null, TransactionPurpose.DONATION, null));

        ReplayResult result = replayer.replay(history);
        printOutput("Lots", result.allLots().size());
        printOutput("Disposals", result.getDisposals().size());

        Map<Long, BigDecimal> disposedByLot = result.getDisposals().stream()
            .collect(Collectors.toMap(LotDisposal::getLotId, LotDisposal::getDisposedBtc, BigDecimal::add));
        for (BitcoinLot lot : result.allLots()) {
            BigDecimal disposed = disposedByLot.getOrDefault(lot.getId(), BigDecimal.ZERO);
            assertEquals(0, lot.getTotalBtc().compareTo(lot.getRemainingBtc().add(disposed)),
                "Lot " + lot.getId() + " must conserve BTC");
        }

        assertBtcReconciles(result);
        assertEquals(7, result.transactionCount());
        printSuccess("Every lot conserves BTC and holdings reconcile");
    }

    @Test
    @DisplayName("Replaying a suffix on top of a seed matches a full replay")
    void testPartialReplayMatchesFull() {
        printTestHeader("Partial Replay Matches Full");

        List<LedgerTransaction> prefix = List.of(
            buy(1, "2024-01-01", "1", "20000"),
            buy(2, "2024-02-01", "1", "30000"),
            sell(3, "2024-03-01", "0.5", "20000"));
        List<LedgerTransaction> suffix = List.of(
            sell(4, "2024-04-01", "1", "45000"),
            buy(5, "2024-05-01", "0.2", "12000"));
        List<LedgerTransaction> all = new ArrayList<>(prefix);
        all.addAll(suffix);

        ReplayResult full = replayer.replay(all);
        ReplayResult head = replayer.replay(prefix);
        ReplaySeed seed = new ReplaySeed(head.openLots(),
            head.getEntries().size() + 1L,
            head.allLots().size() + 1L,
            head.getDisposals().size() + 1L);
        ReplayResult tail = replayer.replay(suffix, seed);

        List<LedgerEntry> entries = new ArrayList<>(head.getEntries());
        entries.addAll(tail.getEntries());
        List<LotDisposal> disposals = new ArrayList<>(head.getDisposals());
        disposals.addAll(tail.getDisposals());

        printOutput("Full entries", full.getEntries().size());
        printOutput("Head + tail entries", entries.size());
        assertEquals(full.getEntries(), entries);
        assertEquals(full.getDisposals(), disposals);
        assertEquals(lotStates(full.openLots()), lotStates(tail.openLots()));
        printSuccess("Partial replay is row-for-row identical");
    }

    @Test
    @DisplayName("Unsaved transactions are refused")
    void testRequiresPersistedTransactions() {
        LedgerTransaction draft = buy(1, "2024-01-01", "1", "1000").toBuilder().id(null).build();
        assertThrows(IllegalArgumentException.class, () -> replayer.replay(List.of(draft)));
    }

    private static void assertBtcReconciles(ReplayResult result) {
        BigDecimal held = result.getEntries().stream()
            .filter(entry -> entry.getCurrency() == CurrencyCode.BTC)
            .filter(entry -> AccountDirectory.isBtcHolding(entry.getAccountId()))
            .map(LedgerEntry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal inLots = result.allLots().stream()
            .map(BitcoinLot::getRemainingBtc)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, held.compareTo(inLots), "BTC in wallets must equal BTC in open lots");
    }
}
