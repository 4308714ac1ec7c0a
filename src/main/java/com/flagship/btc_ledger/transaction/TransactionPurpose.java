package com.flagship.btc_ledger.transaction;

/**
 * Why BTC left the ledger on a withdrawal. GIFT, DONATION and LOST are
 * not sales: they consume lots without realizing a gain.
 */
public enum TransactionPurpose {
    NA,
    SPENT,
    GIFT,
    DONATION,
    LOST;

    public boolean isGiftLike() {
        return this == GIFT || this == DONATION || this == LOST;
    }
}
