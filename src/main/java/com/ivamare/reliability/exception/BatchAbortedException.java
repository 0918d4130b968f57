package com.ivamare.reliability.exception;

/**
 * Raised when cumulative sub-batch failures cross the abort threshold.
 */
public class BatchAbortedException extends ReliabilityException {

    private final long itemsAttempted;
    private final long itemsFailed;

    public BatchAbortedException(long itemsAttempted, long itemsFailed) {
        super("High error rate detected, batch aborted: " + itemsFailed + " of "
            + itemsAttempted + " items failed");
        this.itemsAttempted = itemsAttempted;
        this.itemsFailed = itemsFailed;
    }

    public long getItemsAttempted() {
        return itemsAttempted;
    }

    public long getItemsFailed() {
        return itemsFailed;
    }
}
