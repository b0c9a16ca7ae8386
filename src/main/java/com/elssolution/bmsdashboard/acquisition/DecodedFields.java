package com.elssolution.bmsdashboard.acquisition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Decoded values of one {@link DecodePlan}, in plan order. */
public final class DecodedFields {

    private final Map<String, Number> values;

    DecodedFields(LinkedHashMap<String, Number> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public long integer(String name) {
        return require(name).longValue();
    }

    public int intValue(String name) {
        return Math.toIntExact(integer(name));
    }

    public double decimal(String name) {
        return require(name).doubleValue();
    }

    public Map<String, Number> asMap() {
        return values;
    }

    private Number require(String name) {
        Number n = values.get(name);
        if (n == null) throw new IllegalArgumentException("no field '" + name + "' in plan");
        return n;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
