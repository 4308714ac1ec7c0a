package com.flagship.btc_ledger.ledger;

import com.flagship.btc_ledger.account.Account;
import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.exception.LedgerConsistencyException;
import com.flagship.btc_ledger.recalc.ReplayStage;
import com.flagship.btc_ledger.transaction.LedgerTransaction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Translates one transaction into double-entry postings.
 *
 * Every posting is written as a pair: an outflow and an inflow of the same
 * magnitude in the same currency. Flows that cross the ledger boundary pair
 * with the External account, which is why a Buy or Sell carries a leg
 * against External in each of its two currencies.
 *
 * <pre>
 * DEPOSIT     External -> to                      fee: External -> fees
 * WITHDRAWAL  from -> External                    fee: from -> fees
 * TRANSFER    from -> to                          fee: to -> BTC Fees
 * BUY         from -> External (USD basis)
 *             External -> Exchange BTC (BTC)      fee: from -> USD Fees
 * SELL        Exchange BTC -> External (BTC)
 *             External -> Exchange USD (USD)      fee: Exchange USD -> USD Fees
 * </pre>
 */
public class LedgerPoster {

    public List<LedgerEntry> post(LedgerTransaction transaction, LongSupplier entryIds) {
        List<LedgerEntry> entries = new ArrayList<>();
        Pairs pairs = new Pairs(transaction.getId(), entryIds, entries);

        int from = transaction.getFromAccountId();
        int to = transaction.getToAccountId();
        BigDecimal amount = transaction.getAmount();

        switch (transaction.getType()) {
            case DEPOSIT -> {
                pairs.add(AccountDirectory.EXTERNAL, to, amount, currencyOf(to), EntryType.TRANSFER);
                if (transaction.hasFee()) {
                    pairs.add(AccountDirectory.EXTERNAL, feeSink(transaction), transaction.getFeeAmount(),
                        transaction.getFeeCurrency(), EntryType.FEE);
                }
            }
            case WITHDRAWAL -> {
                pairs.add(from, AccountDirectory.EXTERNAL, amount, currencyOf(from), EntryType.TRANSFER);
                if (transaction.hasFee()) {
                    pairs.add(from, feeSink(transaction), transaction.getFeeAmount(),
                        transaction.getFeeCurrency(), EntryType.FEE);
                }
            }
            case TRANSFER -> {
                pairs.add(from, to, amount, currencyOf(from), EntryType.TRANSFER);
                if (transaction.hasFee()) {
                    pairs.add(to, AccountDirectory.BTC_FEES, transaction.getFeeAmount(),
                        CurrencyCode.BTC, EntryType.FEE);
                }
            }
            case BUY -> {
                pairs.add(from, AccountDirectory.EXTERNAL, transaction.costBasisOrZero(),
                    CurrencyCode.USD, EntryType.TRADE);
                pairs.add(AccountDirectory.EXTERNAL, to, amount, CurrencyCode.BTC, EntryType.TRADE);
                if (transaction.hasFee()) {
                    pairs.add(from, AccountDirectory.USD_FEES, transaction.getFeeAmount(),
                        CurrencyCode.USD, EntryType.FEE);
                }
            }
            case SELL -> {
                pairs.add(from, AccountDirectory.EXTERNAL, amount, CurrencyCode.BTC, EntryType.TRADE);
                pairs.add(AccountDirectory.EXTERNAL, to, transaction.proceedsOrZero(),
                    CurrencyCode.USD, EntryType.TRADE);
                if (transaction.hasFee()) {
                    pairs.add(to, AccountDirectory.USD_FEES, transaction.getFeeAmount(),
                        CurrencyCode.USD, EntryType.FEE);
                }
            }
        }

        verifyBalanced(transaction.getId(), entries);
        return entries;
    }

    /**
     * Throws unless the entries sum to exactly zero in every currency.
     */
    static void verifyBalanced(Long transactionId, List<LedgerEntry> entries) {
        Map<CurrencyCode, BigDecimal> sums = new EnumMap<>(CurrencyCode.class);
        for (LedgerEntry entry : entries) {
            sums.merge(entry.getCurrency(), entry.getAmount(), BigDecimal::add);
        }
        sums.forEach((currency, sum) -> {
            if (sum.signum() != 0) {
                throw new LedgerConsistencyException(transactionId, ReplayStage.PENDING,
                    String.format("Postings for transaction %s do not balance in %s: sum=%s",
                        transactionId, currency, sum.toPlainString()));
            }
        });
    }

    private static CurrencyCode currencyOf(int accountId) {
        return AccountDirectory.require(accountId).getCurrency();
    }

    private static int feeSink(LedgerTransaction transaction) {
        return AccountDirectory.feesFor(transaction.getFeeCurrency()).getId();
    }

    private static final class Pairs {
        private final Long transactionId;
        private final LongSupplier entryIds;
        private final List<LedgerEntry> entries;

        private Pairs(Long transactionId, LongSupplier entryIds, List<LedgerEntry> entries) {
            this.transactionId = transactionId;
            this.entryIds = entryIds;
            this.entries = entries;
        }

        void add(int fromAccountId, int toAccountId, BigDecimal amount, CurrencyCode currency, EntryType type) {
            if (amount.signum() == 0) {
                return;
            }
            Account source = AccountDirectory.require(fromAccountId);
            Account target = AccountDirectory.require(toAccountId);
            if (!source.isExternal() && !source.holds(currency)
                || !target.isExternal() && !target.holds(currency)) {
                throw new LedgerConsistencyException(transactionId, ReplayStage.PENDING, String.format(
                    "Cannot post %s between %s and %s", currency, source.getName(), target.getName()));
            }
            entries.add(new LedgerEntry(entryIds.getAsLong(), transactionId, fromAccountId, amount.negate(), currency, type));
            entries.add(new LedgerEntry(entryIds.getAsLong(), transactionId, toAccountId, amount, currency, type));
        }
    }
}
