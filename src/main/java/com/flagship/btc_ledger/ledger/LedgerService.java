package com.flagship.btc_ledger.ledger;

import com.flagship.btc_ledger.account.Account;
import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads and writes ledger entries.
 *
 * Entries are only ever written by a replay, in one batch per pass. The
 * database re-checks the per-currency balance of every transaction at commit
 * through a deferred constraint trigger, and rejects in-place updates.
 * Balances are derived from entries, never stored.
 */
@Service
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void insertEntries(List<LedgerEntry> entries) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, currency, entry_type) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            entries,
            500,
            (ps, entry) -> {
                ps.setLong(1, entry.getId());
                ps.setLong(2, entry.getTransactionId());
                ps.setInt(3, entry.getAccountId());
                ps.setBigDecimal(4, entry.getAmount());
                ps.setString(5, entry.getCurrency().name());
                ps.setString(6, entry.getEntryType().name());
            });
    }

    /**
     * Balance of one account, in the account's own currency.
     *
     * @throws IllegalArgumentException if the account does not exist or is External
     */
    @Transactional(readOnly = true)
    public AccountBalance getAccountBalance(int accountId) {
        Account account = AccountDirectory.require(accountId);
        if (account.isExternal()) {
            throw new IllegalArgumentException("External has no balance of its own");
        }
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries WHERE account_id = ?",
            BigDecimal.class,
            accountId);
        return toBalance(account, balance);
    }

    /**
     * Balances of every internal account, in account id order.
     */
    @Transactional(readOnly = true)
    public List<AccountBalance> getAllBalances() {
        Map<Integer, BigDecimal> sums = jdbcTemplate.query(
                "SELECT account_id, SUM(amount) AS balance FROM ledger_entries GROUP BY account_id",
                (rs, rowNum) -> Map.entry(rs.getInt("account_id"), rs.getBigDecimal("balance")))
            .stream()
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

        return AccountDirectory.all().stream()
            .filter(account -> !account.isExternal())
            .map(account -> toBalance(account, sums.get(account.getId())))
            .toList();
    }

    /**
     * Sum of BTC held in the wallet and exchange accounts. Always equals the
     * BTC remaining in open lots.
     */
    @Transactional(readOnly = true)
    public BigDecimal getBtcHeld() {
        return AccountDirectory.all().stream()
            .filter(account -> AccountDirectory.isBtcHolding(account.getId()))
            .map(account -> getAccountBalance(account.getId()).getBalance())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAllEntries() {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, currency, entry_type " +
            "FROM ledger_entries ORDER BY id",
            ledgerEntryRowMapper());
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getLedgerEntriesForTransaction(Long transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, currency, entry_type " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY id",
            ledgerEntryRowMapper(),
            transactionId);
    }

    private static AccountBalance toBalance(Account account, BigDecimal sum) {
        CurrencyCode currency = account.getCurrency();
        BigDecimal balance = sum != null ? sum : BigDecimal.ZERO;
        return new AccountBalance(account.getId(), account.getName(), currency, currency.round(balance));
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getLong("id"),
            rs.getLong("transaction_id"),
            rs.getInt("account_id"),
            rs.getBigDecimal("amount"),
            CurrencyCode.valueOf(rs.getString("currency")),
            EntryType.valueOf(rs.getString("entry_type"))
        );
    }
}
