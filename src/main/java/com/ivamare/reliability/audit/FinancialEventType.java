package com.ivamare.reliability.audit;

/**
 * Kind of financial event recorded on the ledger.
 */
public enum FinancialEventType {
    TRANSACTION,
    TRANSFER,
    PAYMENT,
    REFUND,
    FEE,
    INTEREST,
    CHARGEBACK
}
