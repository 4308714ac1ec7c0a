package com.flagship.btc_ledger.account;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currencies the ledger holds, each with the number of decimal places
 * an amount in that currency may carry.
 */
public enum CurrencyCode {
    USD(2),
    BTC(8);

    /**
     * The single rounding mode used for every quantization in the ledger.
     */
    public static final RoundingMode ROUNDING = RoundingMode.HALF_DOWN;

    private final int scale;

    CurrencyCode(int scale) {
        this.scale = scale;
    }

    public int getScale() {
        return scale;
    }

    /**
     * True when the amount has no more decimal places than this currency allows.
     * Trailing zeros are ignored, so 1.50000000 is a valid USD amount.
     */
    public boolean fitsScale(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= scale;
    }

    public BigDecimal round(BigDecimal amount) {
        return amount.setScale(scale, ROUNDING);
    }
}
