package com.flagship.btc_ledger.config;

import com.flagship.btc_ledger.lot.TaxPolicy;
import com.flagship.btc_ledger.recalc.LedgerReplayer;
import com.flagship.btc_ledger.transaction.TransactionRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pure engine classes (replayer, lot rules, validation) into the
 * application context.
 *
 * Tax settings come from ledger.tax.* and default to a 365-day long-term
 * threshold with transfer fees taxed and trade fees capitalized.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Value("${ledger.tax.long-term-threshold-days:365}")
    private int longTermThresholdDays;

    @Value("${ledger.tax.transfer-fee-taxable:true}")
    private boolean transferFeeTaxable;

    @Value("${ledger.tax.capitalize-trade-fees:true}")
    private boolean capitalizeTradeFees;

    @Bean
    public TaxPolicy taxPolicy() {
        if (longTermThresholdDays < 0) {
            throw new IllegalArgumentException(
                "ledger.tax.long-term-threshold-days must not be negative: " + longTermThresholdDays);
        }
        TaxPolicy policy = TaxPolicy.builder()
            .longTermThresholdDays(longTermThresholdDays)
            .transferFeeTaxable(transferFeeTaxable)
            .capitalizeTradeFees(capitalizeTradeFees)
            .build();
        log.info("Tax policy: {}", policy);
        return policy;
    }

    @Bean
    public LedgerReplayer ledgerReplayer(TaxPolicy taxPolicy) {
        return new LedgerReplayer(taxPolicy);
    }

    @Bean
    public TransactionRules transactionRules() {
        return new TransactionRules();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
