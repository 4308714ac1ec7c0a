package com.flagship.btc_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Yearly (or all-time) figures for a tax summary.
 *
 * USD figures are rounded to cents and BTC figures to satoshis. Losses are
 * reported as positive magnitudes; the nets subtract them.
 */
@Value
@Builder
@Jacksonized
public class GainsSummary {

    /** Null for an all-time summary. */
    @JsonProperty("year")
    Integer year;

    @JsonProperty("sells_proceeds")
    BigDecimal sellsProceeds;

    @JsonProperty("withdrawals_spent")
    BigDecimal withdrawalsSpent;

    @JsonProperty("income_earned")
    BigDecimal incomeEarned;

    @JsonProperty("income_btc")
    BigDecimal incomeBtc;

    @JsonProperty("interest_earned")
    BigDecimal interestEarned;

    @JsonProperty("interest_btc")
    BigDecimal interestBtc;

    @JsonProperty("rewards_earned")
    BigDecimal rewardsEarned;

    @JsonProperty("rewards_btc")
    BigDecimal rewardsBtc;

    @JsonProperty("gifts_received")
    BigDecimal giftsReceived;

    @JsonProperty("gifts_btc")
    BigDecimal giftsBtc;

    @JsonProperty("total_income")
    BigDecimal totalIncome;

    @JsonProperty("short_term_gains")
    BigDecimal shortTermGains;

    @JsonProperty("short_term_losses")
    BigDecimal shortTermLosses;

    @JsonProperty("short_term_net")
    BigDecimal shortTermNet;

    @JsonProperty("long_term_gains")
    BigDecimal longTermGains;

    @JsonProperty("long_term_losses")
    BigDecimal longTermLosses;

    @JsonProperty("long_term_net")
    BigDecimal longTermNet;

    @JsonProperty("total_net_capital_gains")
    BigDecimal totalNetCapitalGains;

    @JsonProperty("fees_usd")
    BigDecimal feesUsd;

    @JsonProperty("fees_btc")
    BigDecimal feesBtc;

    @JsonProperty("year_to_date_capital_gains")
    BigDecimal yearToDateCapitalGains;
}
