package com.flagship.btc_ledger.account;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of accounts. Ids match the rows seeded by the V1 migration.
 */
public final class AccountDirectory {

    public static final int BANK = 1;
    public static final int WALLET = 2;
    public static final int EXCHANGE_USD = 3;
    public static final int EXCHANGE_BTC = 4;
    public static final int BTC_FEES = 5;
    public static final int USD_FEES = 6;
    public static final int EXTERNAL = 99;

    private static final Map<Integer, Account> ACCOUNTS;

    static {
        Map<Integer, Account> accounts = new LinkedHashMap<>();
        register(accounts, new Account(BANK, "Bank", CurrencyCode.USD, AccountKind.BANK));
        register(accounts, new Account(WALLET, "Wallet", CurrencyCode.BTC, AccountKind.WALLET));
        register(accounts, new Account(EXCHANGE_USD, "Exchange USD", CurrencyCode.USD, AccountKind.EXCHANGE_USD));
        register(accounts, new Account(EXCHANGE_BTC, "Exchange BTC", CurrencyCode.BTC, AccountKind.EXCHANGE_BTC));
        register(accounts, new Account(BTC_FEES, "BTC Fees", CurrencyCode.BTC, AccountKind.FEES));
        register(accounts, new Account(USD_FEES, "USD Fees", CurrencyCode.USD, AccountKind.FEES));
        register(accounts, new Account(EXTERNAL, "External", null, AccountKind.EXTERNAL));
        ACCOUNTS = Collections.unmodifiableMap(accounts);
    }

    private AccountDirectory() {
        // Utility class
    }

    private static void register(Map<Integer, Account> accounts, Account account) {
        accounts.put(account.getId(), account);
    }

    public static Optional<Account> find(int accountId) {
        return Optional.ofNullable(ACCOUNTS.get(accountId));
    }

    /**
     * @throws IllegalArgumentException if no account has this id
     */
    public static Account require(int accountId) {
        return find(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
    }

    public static Collection<Account> all() {
        return ACCOUNTS.values();
    }

    /**
     * Fee sink for the given fee currency.
     */
    public static Account feesFor(CurrencyCode currency) {
        return require(currency == CurrencyCode.BTC ? BTC_FEES : USD_FEES);
    }

    /**
     * True for the accounts whose BTC balance must equal the open lots:
     * internal BTC accounts other than the fee sink.
     */
    public static boolean isBtcHolding(int accountId) {
        return find(accountId)
            .map(account -> account.isHolding() && account.holds(CurrencyCode.BTC))
            .orElse(false);
    }
}
