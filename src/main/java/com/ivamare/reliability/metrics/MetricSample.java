package com.ivamare.reliability.metrics;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A named, tagged numeric sample emitted by the reliability core.
 *
 * @param category Metric category, e.g. {@code circuit_breaker} or {@code business.volume}
 * @param name Metric name within the category
 * @param value Sampled value
 * @param unit Unit of the value
 * @param timestamp When the sample was taken
 * @param tags Free-form tags (never null)
 */
public record MetricSample(
    String category,
    String name,
    double value,
    String unit,
    Instant timestamp,
    Map<String, Object> tags
) {
    public MetricSample {
        tags = tags != null ? Map.copyOf(withoutNullValues(tags)) : Map.of();
    }

    /**
     * Buffer key, {@code category.name}.
     */
    public String key() {
        return category + "." + name;
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> tags) {
        if (!tags.containsValue(null)) {
            return tags;
        }
        Map<String, Object> copy = new HashMap<>();
        tags.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
