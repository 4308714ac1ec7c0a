package com.flagship.btc_ledger.lot;

/**
 * What kind of event consumed a lot fragment.
 */
public enum DisposalKind {
    SELL,
    WITHDRAWAL,
    GIFT,
    TRANSFER_FEE
}
