package com.flagship.btc_ledger.lot;

import lombok.Value;

import java.math.BigDecimal;

/**
 * How much BTC a transaction takes out of the lots and what it received
 * for it in total.
 */
@Value
public class DisposalRequest {
    BigDecimal requiredBtc;
    BigDecimal proceedsUsd;
    DisposalKind kind;
    boolean reportable;
}
