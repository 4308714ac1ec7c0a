package com.flagship.btc_ledger.observability;

import com.flagship.btc_ledger.account.AccountDirectory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Reports DOWN when the stored ledger breaks one of its invariants:
 * <ul>
 *   <li>a transaction's entries do not sum to zero in some currency</li>
 *   <li>a lot's disposals plus its remainder differ from its size</li>
 *   <li>BTC in the wallet and exchange accounts differs from BTC in open lots</li>
 * </ul>
 * Any of these means a replay was interrupted or a row was edited by hand.
 */
@Component("ledgerInvariants")
public class LedgerHealthIndicator implements HealthIndicator {

    private static final String UNBALANCED_SQL =
        "SELECT COUNT(*) FROM (SELECT transaction_id, currency FROM ledger_entries " +
        "GROUP BY transaction_id, currency HAVING SUM(amount) <> 0) unbalanced";

    private static final String UNCONSERVED_LOTS_SQL =
        "SELECT COUNT(*) FROM bitcoin_lots l WHERE l.remaining_btc + COALESCE(" +
        "(SELECT SUM(d.disposed_btc) FROM lot_disposals d WHERE d.lot_id = l.id), 0) <> l.total_btc";

    private final JdbcTemplate jdbcTemplate;

    public LedgerHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            Long unbalanced = jdbcTemplate.queryForObject(UNBALANCED_SQL, Long.class);
            Long unconserved = jdbcTemplate.queryForObject(UNCONSERVED_LOTS_SQL, Long.class);
            BigDecimal accountBtc = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries WHERE account_id IN (?, ?)",
                BigDecimal.class, AccountDirectory.WALLET, AccountDirectory.EXCHANGE_BTC);
            BigDecimal lotBtc = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(remaining_btc), 0) FROM bitcoin_lots", BigDecimal.class);

            boolean reconciled = accountBtc != null && lotBtc != null && accountBtc.compareTo(lotBtc) == 0;
            boolean healthy = reconciled && count(unbalanced) == 0 && count(unconserved) == 0;

            return (healthy ? Health.up() : Health.down())
                    .withDetail("unbalancedTransactions", count(unbalanced))
                    .withDetail("unconservedLots", count(unconserved))
                    .withDetail("accountBtc", accountBtc)
                    .withDetail("lotBtc", lotBtc)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    private static long count(Long value) {
        return value != null ? value : 0;
    }
}
