package org.caureq.hostwatch.service.alerts;

import java.util.Map;

/** Typed accessors over a loosely typed parameter map. */
final class Params {
    private Params() {}

    static double percent(String kind, Map<String, Object> m, String key) {
        double v = number(kind, m, key);
        if (Double.isNaN(v) || v < 0.0 || v > 100.0) {
            throw new InvalidCheckConfigException(kind, key + " must be between 0 and 100, got " + v);
        }
        return v;
    }

    static int positiveInt(String kind, Map<String, Object> m, String key) {
        double v = number(kind, m, key);
        if (v != Math.rint(v) || v < 1 || v > Integer.MAX_VALUE) {
            throw new InvalidCheckConfigException(kind, key + " must be a positive whole number, got " + m.get(key));
        }
        return (int) v;
    }

    private static double number(String kind, Map<String, Object> m, String key) {
        Object raw = m.get(key);
        if (raw == null) {
            throw new InvalidCheckConfigException(kind, "missing parameter " + key);
        }
        if (raw instanceof Number n) return n.doubleValue();
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new InvalidCheckConfigException(kind, key + " is not a number: '" + s + "'", e);
            }
        }
        throw new InvalidCheckConfigException(kind, key + " has unsupported type " + raw.getClass().getSimpleName());
    }
}
