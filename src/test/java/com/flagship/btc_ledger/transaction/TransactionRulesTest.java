package com.flagship.btc_ledger.transaction;

import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.transaction.command.BuyCommand;
import com.flagship.btc_ledger.transaction.command.DepositCommand;
import com.flagship.btc_ledger.transaction.command.SellCommand;
import com.flagship.btc_ledger.transaction.command.TransactionCommand;
import com.flagship.btc_ledger.transaction.command.TransferCommand;
import com.flagship.btc_ledger.transaction.command.WithdrawalCommand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validation rules applied before anything is stored.
 */
class TransactionRulesTest {

    private final TransactionRules rules = new TransactionRules();
    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00.123456789Z"), ZoneOffset.UTC);

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private LedgerTransaction draft(TransactionCommand command) {
        return command.toDraft(clock);
    }

    private String rejection(TransactionCommand command) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> rules.validate(draft(command)));
        printExpectedException("IllegalArgumentException", e.getMessage());
        return e.getMessage();
    }

    @Test
    @DisplayName("Well-formed transactions of every type pass")
    void testValidTransactions() {
        printTestHeader("Valid Transactions");

        assertDoesNotThrow(() -> rules.validate(draft(DepositCommand.builder()
            .toAccountId(AccountDirectory.WALLET).amount(new BigDecimal("0.12345678"))
            .feeAmount(new BigDecimal("0.00001")).costBasisUsd(new BigDecimal("5000.10")).build())));
        assertDoesNotThrow(() -> rules.validate(draft(DepositCommand.builder()
            .toAccountId(AccountDirectory.BANK).amount(new BigDecimal("1000.00")).build())));
        assertDoesNotThrow(() -> rules.validate(draft(WithdrawalCommand.builder()
            .fromAccountId(AccountDirectory.WALLET).amount(new BigDecimal("0.1"))
            .purpose(TransactionPurpose.SPENT).proceedsUsd(new BigDecimal("4000")).build())));
        assertDoesNotThrow(() -> rules.validate(draft(TransferCommand.builder()
            .fromAccountId(AccountDirectory.EXCHANGE_BTC).toAccountId(AccountDirectory.WALLET)
            .amount(new BigDecimal("0.5")).feeAmount(new BigDecimal("0.0001")).fmvUsd(new BigDecimal("6.50")).build())));
        assertDoesNotThrow(() -> rules.validate(draft(TransferCommand.builder()
            .fromAccountId(AccountDirectory.BANK).toAccountId(AccountDirectory.EXCHANGE_USD)
            .amount(new BigDecimal("250")).build())));
        assertDoesNotThrow(() -> rules.validate(draft(BuyCommand.builder()
            .fromAccountId(AccountDirectory.EXCHANGE_USD).amount(new BigDecimal("0.25"))
            .costBasisUsd(new BigDecimal("15000")).feeAmount(new BigDecimal("12.50")).build())));
        assertDoesNotThrow(() -> rules.validate(draft(SellCommand.builder()
            .amount(new BigDecimal("0.25")).proceedsUsd(new BigDecimal("17000")).build())));
    }

    @Test
    @DisplayName("Account roles are enforced per type")
    void testAccountRoles() {
        printTestHeader("Account Roles");

        assertEquals("Deposits must go to a Bank, Wallet or Exchange account",
            rejection(DepositCommand.builder().toAccountId(AccountDirectory.BTC_FEES).amount(BigDecimal.ONE).build()));
        assertEquals("Transfers cannot change currency",
            rejection(TransferCommand.builder().fromAccountId(AccountDirectory.BANK)
                .toAccountId(AccountDirectory.WALLET).amount(BigDecimal.ONE).build()));
        assertEquals("From and to accounts must differ",
            rejection(TransferCommand.builder().fromAccountId(AccountDirectory.WALLET)
                .toAccountId(AccountDirectory.WALLET).amount(BigDecimal.ONE).build()));
        assertEquals("Buys are funded from Bank or Exchange USD",
            rejection(BuyCommand.builder().fromAccountId(AccountDirectory.WALLET)
                .amount(BigDecimal.ONE).costBasisUsd(BigDecimal.TEN).build()));
        assertEquals("Withdrawals must come from a Bank, Wallet or Exchange account",
            rejection(WithdrawalCommand.builder().fromAccountId(AccountDirectory.USD_FEES)
                .amount(BigDecimal.ONE).build()));
    }

    @Test
    @DisplayName("Unknown accounts are named in the error")
    void testUnknownAccount() {
        assertEquals("Unknown to account: 42",
            rejection(DepositCommand.builder().toAccountId(42).amount(BigDecimal.ONE).build()));
        assertEquals("Unknown from account: 0",
            rejection(WithdrawalCommand.builder().amount(BigDecimal.ONE).build()));
    }

    @Test
    @DisplayName("Fee rules: transfers only in BTC and below the amount")
    void testFeeRules() {
        printTestHeader("Fee Rules");

        assertEquals("Transfer fees are only supported in BTC",
            rejection(TransferCommand.builder().fromAccountId(AccountDirectory.BANK)
                .toAccountId(AccountDirectory.EXCHANGE_USD).amount(BigDecimal.TEN).feeAmount(BigDecimal.ONE).build()));
        assertEquals("Transfer fee must be smaller than the amount transferred",
            rejection(TransferCommand.builder().fromAccountId(AccountDirectory.WALLET)
                .toAccountId(AccountDirectory.EXCHANGE_BTC).amount(new BigDecimal("0.001"))
                .feeAmount(new BigDecimal("0.001")).build()));
    }

    @Test
    @DisplayName("Required USD fields per type")
    void testRequiredUsdFields() {
        assertEquals("Spent withdrawals require proceeds_usd",
            rejection(WithdrawalCommand.builder().fromAccountId(AccountDirectory.WALLET)
                .amount(BigDecimal.ONE).purpose(TransactionPurpose.SPENT).build()));
        assertEquals("Sells require proceeds_usd",
            rejection(SellCommand.builder().amount(BigDecimal.ONE).build()));
    }

    @Test
    @DisplayName("Precision is limited to 8 places for BTC and 2 for USD")
    void testPrecision() {
        printTestHeader("Precision");

        assertTrue(rejection(DepositCommand.builder().toAccountId(AccountDirectory.WALLET)
            .amount(new BigDecimal("0.123456789")).build()).startsWith("amount allows at most 8"));
        assertTrue(rejection(DepositCommand.builder().toAccountId(AccountDirectory.BANK)
            .amount(new BigDecimal("10.001")).build()).startsWith("amount allows at most 2"));
        assertTrue(rejection(SellCommand.builder().amount(BigDecimal.ONE)
            .proceedsUsd(new BigDecimal("100.555")).build()).startsWith("proceeds_usd allows at most 2"));
        assertDoesNotThrow(() -> rules.validate(draft(DepositCommand.builder().toAccountId(AccountDirectory.BANK)
            .amount(new BigDecimal("10.10000000")).build())));
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testAmountMustBePositive() {
        assertEquals("Amount must be greater than 0",
            rejection(SellCommand.builder().amount(BigDecimal.ZERO).proceedsUsd(BigDecimal.TEN).build()));
    }

    @Test
    @DisplayName("Drafts default the timestamp to now, truncated to microseconds")
    void testDraftTimestamp() {
        LedgerTransaction txn = draft(SellCommand.builder().amount(BigDecimal.ONE).proceedsUsd(BigDecimal.TEN).build());
        assertEquals(Instant.parse("2024-06-01T12:00:00.123456Z"), txn.getTimestamp());
        assertEquals(AccountDirectory.EXCHANGE_BTC, txn.getFromAccountId());
        assertEquals(AccountDirectory.EXCHANGE_USD, txn.getToAccountId());
        assertNull(txn.getFeeCurrency(), "No fee, no fee currency");
    }
}
