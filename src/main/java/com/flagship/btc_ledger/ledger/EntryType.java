package com.flagship.btc_ledger.ledger;

/**
 * What a posting pair represents. TRANSFER moves value between accounts,
 * TRADE is one leg of a Buy or Sell, FEE settles into a fee sink.
 */
public enum EntryType {
    TRANSFER,
    TRADE,
    FEE
}
