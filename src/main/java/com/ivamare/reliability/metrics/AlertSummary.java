package com.ivamare.reliability.metrics;

/**
 * Counts of unresolved alerts.
 *
 * @param active All unresolved alerts
 * @param critical Unresolved CRITICAL or EMERGENCY alerts
 * @param warning Unresolved WARNING alerts
 */
public record AlertSummary(int active, int critical, int warning) {
}
