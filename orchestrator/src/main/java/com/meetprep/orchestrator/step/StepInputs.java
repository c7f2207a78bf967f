package com.meetprep.orchestrator.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the inputs a step declared, drawn from the caller's
 * seed data and the results of earlier steps.
 */
public final class StepInputs {

    private final Map<String, Object> values;

    private StepInputs(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** Project {@code available} down to {@code declared}, skipping absent keys. */
    public static StepInputs select(Map<String, ?> available, List<String> declared) {
        Map<String, Object> picked = new LinkedHashMap<>();
        for (String key : declared) {
            Object value = available.get(key);
            if (value != null) picked.put(key, value);
        }
        return new StepInputs(picked);
    }

    public static StepInputs of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> { if (v != null) copy.put(k, v); });
        return new StepInputs(copy);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /** String form of an input, or "" when absent. */
    public String text(String key) {
        Object value = values.get(key);
        return value == null ? "" : value.toString();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "StepInputs" + values.keySet();
    }
}
