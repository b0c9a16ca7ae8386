package com.elssolution.bmsdashboard.acquisition;

import java.util.List;

/** Ordered positional layout of one payload; must match the firmware exactly. */
public record DecodePlan(String key, List<FieldSpec> fields) {

    public DecodePlan {
        fields = List.copyOf(fields);
        if (fields.isEmpty()) throw new IllegalArgumentException("empty decode plan for " + key);
    }

    public static DecodePlan of(String key, FieldSpec... fields) {
        return new DecodePlan(key, List.of(fields));
    }
}
