package com.flagship.btc_ledger.transaction;

import com.flagship.btc_ledger.account.Account;
import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.AccountKind;
import com.flagship.btc_ledger.account.CurrencyCode;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * Checks a transaction before it reaches the engine.
 *
 * <pre>
 * type        from                   to                          fee currency
 * DEPOSIT     External               internal, not a fee sink    deposited asset
 * WITHDRAWAL  internal, not a sink   External                    withdrawn asset
 * TRANSFER    internal, not a sink   internal, same currency     BTC only
 * BUY         Bank or Exchange USD   Exchange BTC                USD only
 * SELL        Exchange BTC           Exchange USD                USD only
 * </pre>
 *
 * Amounts must be positive and fit their currency's precision. Violations
 * throw IllegalArgumentException with the first problem found.
 */
public class TransactionRules {

    private static final BigDecimal MAX_MAGNITUDE = new BigDecimal("10000000000");
    private static final Set<AccountKind> BUY_FUNDING = EnumSet.of(AccountKind.BANK, AccountKind.EXCHANGE_USD);

    public void validate(LedgerTransaction transaction) {
        require(transaction.getType() != null, "Transaction type is required");
        require(transaction.getTimestamp() != null, "Timestamp is required");
        require(transaction.getAmount() != null, "Amount is required");
        require(transaction.getAmount().signum() > 0, "Amount must be greater than 0");

        Account from = account(transaction.getFromAccountId(), "from");
        Account to = account(transaction.getToAccountId(), "to");
        require(from.getId() != to.getId(), "From and to accounts must differ");

        BigDecimal fee = transaction.getFeeAmount();
        if (fee != null) {
            require(fee.signum() >= 0, "Fee cannot be negative");
        }
        if (transaction.hasFee()) {
            require(transaction.getFeeCurrency() != null, "Fee currency is required when a fee is charged");
        }

        switch (transaction.getType()) {
            case DEPOSIT -> validateDeposit(transaction, from, to);
            case WITHDRAWAL -> validateWithdrawal(transaction, from, to);
            case TRANSFER -> validateTransfer(transaction, from, to);
            case BUY -> validateBuy(transaction, from, to);
            case SELL -> validateSell(transaction, from, to);
        }

        validatePrecision(transaction, assetCurrency(transaction, from, to));
    }

    private void validateDeposit(LedgerTransaction transaction, Account from, Account to) {
        require(from.isExternal(), "Deposits must come from External");
        require(to.isHolding(), "Deposits must go to a Bank, Wallet or Exchange account");
        requireFeeCurrency(transaction, to.getCurrency(), "Deposit fee must be in the deposited currency");
        require(transaction.getPurpose() == null || transaction.getPurpose() == TransactionPurpose.NA,
            "Deposits have no purpose");
    }

    private void validateWithdrawal(LedgerTransaction transaction, Account from, Account to) {
        require(from.isHolding(), "Withdrawals must come from a Bank, Wallet or Exchange account");
        require(to.isExternal(), "Withdrawals must go to External");
        requireFeeCurrency(transaction, from.getCurrency(), "Withdrawal fee must be in the withdrawn currency");
        if (transaction.getPurpose() == TransactionPurpose.SPENT) {
            require(transaction.getProceedsUsd() != null, "Spent withdrawals require proceeds_usd");
        }
        require(transaction.getSource() == null || transaction.getSource() == TransactionSource.NA,
            "Withdrawals have no source");
    }

    private void validateTransfer(LedgerTransaction transaction, Account from, Account to) {
        require(from.isHolding() && to.isHolding(),
            "Transfers move funds between Bank, Wallet and Exchange accounts");
        require(from.getCurrency() == to.getCurrency(), "Transfers cannot change currency");
        if (transaction.hasFee()) {
            require(from.holds(CurrencyCode.BTC) && transaction.getFeeCurrency() == CurrencyCode.BTC,
                "Transfer fees are only supported in BTC");
            require(transaction.getFeeAmount().compareTo(transaction.getAmount()) < 0,
                "Transfer fee must be smaller than the amount transferred");
        }
    }

    private void validateBuy(LedgerTransaction transaction, Account from, Account to) {
        require(BUY_FUNDING.contains(from.getKind()), "Buys are funded from Bank or Exchange USD");
        require(to.getKind() == AccountKind.EXCHANGE_BTC, "Buys deliver to Exchange BTC");
        require(transaction.getCostBasisUsd() != null, "Buys require cost_basis_usd");
        requireFeeCurrency(transaction, CurrencyCode.USD, "Buy fees must be in USD");
    }

    private void validateSell(LedgerTransaction transaction, Account from, Account to) {
        require(from.getKind() == AccountKind.EXCHANGE_BTC, "Sells take BTC from Exchange BTC");
        require(to.getKind() == AccountKind.EXCHANGE_USD, "Sells pay out to Exchange USD");
        require(transaction.getProceedsUsd() != null, "Sells require proceeds_usd");
        requireFeeCurrency(transaction, CurrencyCode.USD, "Sell fees must be in USD");
    }

    private void validatePrecision(LedgerTransaction transaction, CurrencyCode assetCurrency) {
        requireAmount(transaction.getAmount(), assetCurrency, "amount");
        if (transaction.hasFee()) {
            requireAmount(transaction.getFeeAmount(), transaction.getFeeCurrency(), "fee_amount");
        }
        requireUsd(transaction.getCostBasisUsd(), "cost_basis_usd");
        requireUsd(transaction.getProceedsUsd(), "proceeds_usd");
        requireUsd(transaction.getFmvUsd(), "fmv_usd");
    }

    private static CurrencyCode assetCurrency(LedgerTransaction transaction, Account from, Account to) {
        return switch (transaction.getType()) {
            case BUY, SELL -> CurrencyCode.BTC;
            case DEPOSIT -> to.getCurrency();
            case WITHDRAWAL, TRANSFER -> from.getCurrency();
        };
    }

    private static void requireUsd(BigDecimal value, String field) {
        if (value == null) {
            return;
        }
        require(value.signum() >= 0, field + " cannot be negative");
        requireAmount(value, CurrencyCode.USD, field);
    }

    private static void requireAmount(BigDecimal value, CurrencyCode currency, String field) {
        require(currency.fitsScale(value), String.format(
            "%s allows at most %d decimal places for %s", field, currency.getScale(), currency));
        require(value.abs().compareTo(MAX_MAGNITUDE) < 0, field + " is too large");
    }

    private static void requireFeeCurrency(LedgerTransaction transaction, CurrencyCode expected, String message) {
        if (transaction.hasFee()) {
            require(transaction.getFeeCurrency() == expected, message);
        }
    }

    private static Account account(int accountId, String side) {
        return AccountDirectory.find(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown " + side + " account: " + accountId));
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
