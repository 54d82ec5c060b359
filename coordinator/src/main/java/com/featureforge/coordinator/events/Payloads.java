package com.featureforge.coordinator.events;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds event payloads from alternating keys and values, keeping their
 * order. Unlike Map.of, null values are allowed.
 */
public final class Payloads {

    private Payloads() {}

    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Payload needs key/value pairs, got " + keyValues.length + " items");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }
}
