package com.flagship.btc_ledger.lot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.flagship.btc_ledger.TestTransactions.day;
import static org.junit.jupiter.api.Assertions.*;

class TaxPolicyTest {

    @Test
    @DisplayName("Defaults: 365 days, transfer fees taxed, trade fees capitalized")
    void testDefaults() {
        TaxPolicy policy = TaxPolicy.defaults();
        assertEquals(365, policy.getLongTermThresholdDays());
        assertTrue(policy.isTransferFeeTaxable());
        assertTrue(policy.isCapitalizeTradeFees());
    }

    @Test
    @DisplayName("Partial days do not count toward the threshold")
    void testWholeDaysOnly() {
        TaxPolicy policy = TaxPolicy.defaults();
        Instant acquired = day("2023-01-01");

        assertEquals(HoldingPeriod.SHORT, policy.classify(acquired, day("2024-01-01").plusSeconds(86_399)));
        assertEquals(HoldingPeriod.LONG, policy.classify(acquired, day("2024-01-02")));
        assertEquals(HoldingPeriod.SHORT, policy.classify(acquired, acquired));
    }

    @Test
    @DisplayName("The threshold is configurable")
    void testCustomThreshold() {
        TaxPolicy policy = TaxPolicy.builder().longTermThresholdDays(30).build();

        assertEquals(HoldingPeriod.SHORT, policy.classify(day("2024-01-01"), day("2024-01-31")));
        assertEquals(HoldingPeriod.LONG, policy.classify(day("2024-01-01"), day("2024-02-01")));
    }
}
