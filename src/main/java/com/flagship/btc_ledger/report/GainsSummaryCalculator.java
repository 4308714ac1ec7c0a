package com.flagship.btc_ledger.report;

import com.flagship.btc_ledger.account.AccountDirectory;
import com.flagship.btc_ledger.account.CurrencyCode;
import com.flagship.btc_ledger.lot.HoldingPeriod;
import com.flagship.btc_ledger.lot.LotDisposal;
import com.flagship.btc_ledger.transaction.LedgerTransaction;
import com.flagship.btc_ledger.transaction.TransactionPurpose;
import com.flagship.btc_ledger.transaction.TransactionSource;
import com.flagship.btc_ledger.transaction.TransactionType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates stored transactions and disposals into a {@link GainsSummary}.
 *
 * Capital gains come from reportable disposals only, never from the
 * transaction roll-ups, so nothing is counted twice. SPENT withdrawals show
 * up in withdrawalsSpent for reference; their gain or loss is already in the
 * disposals. Income figures come from deposits by source, valued at the
 * deposit's cost basis. Gifts received are listed but are not income.
 *
 * Years are calendar years in UTC.
 */
public class GainsSummaryCalculator {

    private final Clock clock;

    public GainsSummaryCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param year calendar year to restrict to, or null for all time
     */
    public GainsSummary summarize(List<LedgerTransaction> transactions, List<LotDisposal> disposals, Integer year) {
        YearWindow window = year == null ? YearWindow.ALL_TIME : YearWindow.of(year);

        BigDecimal shortGains = BigDecimal.ZERO;
        BigDecimal shortLosses = BigDecimal.ZERO;
        BigDecimal longGains = BigDecimal.ZERO;
        BigDecimal longLosses = BigDecimal.ZERO;

        for (LotDisposal disposal : disposals) {
            if (!disposal.isReportable() || !window.contains(disposal.getDisposedAt())) {
                continue;
            }
            BigDecimal gain = disposal.getRealizedGainUsd();
            boolean longTerm = disposal.getHoldingPeriod() == HoldingPeriod.LONG;
            if (gain.signum() > 0) {
                if (longTerm) {
                    longGains = longGains.add(gain);
                } else {
                    shortGains = shortGains.add(gain);
                }
            } else if (gain.signum() < 0) {
                if (longTerm) {
                    longLosses = longLosses.add(gain.abs());
                } else {
                    shortLosses = shortLosses.add(gain.abs());
                }
            }
        }

        BigDecimal sellsProceeds = BigDecimal.ZERO;
        BigDecimal withdrawalsSpent = BigDecimal.ZERO;
        Map<TransactionSource, BigDecimal> receivedUsd = new EnumMap<>(TransactionSource.class);
        Map<TransactionSource, BigDecimal> receivedBtc = new EnumMap<>(TransactionSource.class);
        Map<CurrencyCode, BigDecimal> fees = new EnumMap<>(CurrencyCode.class);

        for (LedgerTransaction txn : transactions) {
            if (!window.contains(txn.getTimestamp())) {
                continue;
            }
            if (txn.getType() == TransactionType.SELL) {
                sellsProceeds = sellsProceeds.add(txn.proceedsOrZero());
            }
            if (txn.getType() == TransactionType.WITHDRAWAL && txn.purposeOrDefault() == TransactionPurpose.SPENT) {
                withdrawalsSpent = withdrawalsSpent.add(txn.proceedsOrZero());
            }
            if (txn.getType() == TransactionType.DEPOSIT && txn.getSource() != null) {
                if (txn.costBasisOrZero().signum() > 0) {
                    receivedUsd.merge(txn.getSource(), txn.getCostBasisUsd(), BigDecimal::add);
                }
                if (AccountDirectory.isBtcHolding(txn.getToAccountId())) {
                    receivedBtc.merge(txn.getSource(), txn.getAmount(), BigDecimal::add);
                }
            }
            if (txn.hasFee() && txn.getFeeCurrency() != null) {
                fees.merge(txn.getFeeCurrency(), txn.getFeeAmount(), BigDecimal::add);
            }
        }

        BigDecimal income = sum(receivedUsd, TransactionSource.INCOME);
        BigDecimal interest = sum(receivedUsd, TransactionSource.INTEREST);
        BigDecimal rewards = sum(receivedUsd, TransactionSource.REWARD);
        BigDecimal shortNet = shortGains.subtract(shortLosses);
        BigDecimal longNet = longGains.subtract(longLosses);

        return GainsSummary.builder()
            .year(year)
            .sellsProceeds(usd(sellsProceeds))
            .withdrawalsSpent(usd(withdrawalsSpent))
            .incomeEarned(usd(income))
            .incomeBtc(btc(sum(receivedBtc, TransactionSource.INCOME)))
            .interestEarned(usd(interest))
            .interestBtc(btc(sum(receivedBtc, TransactionSource.INTEREST)))
            .rewardsEarned(usd(rewards))
            .rewardsBtc(btc(sum(receivedBtc, TransactionSource.REWARD)))
            .giftsReceived(usd(sum(receivedUsd, TransactionSource.GIFT)))
            .giftsBtc(btc(sum(receivedBtc, TransactionSource.GIFT)))
            .totalIncome(usd(income.add(interest).add(rewards)))
            .shortTermGains(usd(shortGains))
            .shortTermLosses(usd(shortLosses))
            .shortTermNet(usd(shortNet))
            .longTermGains(usd(longGains))
            .longTermLosses(usd(longLosses))
            .longTermNet(usd(longNet))
            .totalNetCapitalGains(usd(shortNet.add(longNet)))
            .feesUsd(usd(fees.getOrDefault(CurrencyCode.USD, BigDecimal.ZERO)))
            .feesBtc(btc(fees.getOrDefault(CurrencyCode.BTC, BigDecimal.ZERO)))
            .yearToDateCapitalGains(usd(yearToDate(disposals)))
            .build();
    }

    /**
     * Net reportable gain of everything disposed since January 1 of the
     * clock's current year.
     */
    private BigDecimal yearToDate(List<LotDisposal> disposals) {
        Instant startOfYear = YearWindow.of(LocalDate.now(clock.withZone(ZoneOffset.UTC)).getYear()).start;
        return disposals.stream()
            .filter(LotDisposal::isReportable)
            .filter(disposal -> !disposal.getDisposedAt().isBefore(startOfYear))
            .map(LotDisposal::getRealizedGainUsd)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal sum(Map<TransactionSource, BigDecimal> totals, TransactionSource source) {
        return totals.getOrDefault(source, BigDecimal.ZERO);
    }

    private static BigDecimal usd(BigDecimal value) {
        return CurrencyCode.USD.round(value);
    }

    private static BigDecimal btc(BigDecimal value) {
        return CurrencyCode.BTC.round(value);
    }

    private static final class YearWindow {

        static final YearWindow ALL_TIME = new YearWindow(null, null);

        final Instant start;
        final Instant end;

        private YearWindow(Instant start, Instant end) {
            this.start = start;
            this.end = end;
        }

        static YearWindow of(int year) {
            return new YearWindow(
                LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                LocalDate.of(year + 1, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant());
        }

        boolean contains(Instant instant) {
            return start == null || (!instant.isBefore(start) && instant.isBefore(end));
        }
    }
}
