package com.flagship.btc_ledger.exception;

import com.flagship.btc_ledger.recalc.ReplayStage;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * A BTC-disposing transaction needs more BTC than the open lots hold at
 * its position in history.
 */
@Getter
public class InsufficientBitcoinException extends LedgerReplayException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBitcoinException(Long transactionId, ReplayStage stage,
                                        BigDecimal required, BigDecimal available) {
        super(transactionId, stage, String.format(
            "Transaction %s needs %s BTC but only %s BTC is held in open lots",
            transactionId, required.toPlainString(), available.toPlainString()));
        this.required = required;
        this.available = available;
    }
}
