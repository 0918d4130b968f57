package com.ivamare.reliability.model;

/**
 * Kind of records handed to the batching engine.
 */
public enum DataType {
    /** Monetary movements; financial value is summed per record */
    TRANSACTION,

    /** Customer or account master data */
    ACCOUNT,

    /** Static lookup data, safe to process in large batches */
    REFERENCE,

    /** Operational log records */
    LOG,

    /** Audit records */
    AUDIT
}
