package com.ivamare.reliability.audit.compliance;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Reads loosely typed values out of event metadata and entry details.
 */
final class MetadataValues {

    private MetadataValues() {
    }

    /**
     * True for {@code Boolean.TRUE}, the string "true" or a non-zero number.
     */
    static boolean isSet(Map<String, Object> metadata, String key) {
        if (metadata == null) {
            return false;
        }
        Object value = metadata.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text.trim());
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        return false;
    }

    /**
     * Positive decimal under {@code key}, or the fallback when absent, zero or unparsable.
     */
    static BigDecimal decimal(Map<String, Object> metadata, String key, BigDecimal fallback) {
        if (metadata == null) {
            return fallback;
        }
        BigDecimal value = toDecimal(metadata.get(key));
        return value != null && value.signum() > 0 ? value : fallback;
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> nested(Map<String, Object> map, String key) {
        Object value = map != null ? map.get(key) : null;
        return value instanceof Map<?, ?> nested ? (Map<String, Object>) nested : Map.of();
    }
}
