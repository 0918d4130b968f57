package com.ivamare.reliability.model;

/**
 * Data classification of a batch.
 */
public enum Sensitivity {
    PUBLIC,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED
}
