package io.datahub.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Applied to every payload handed to the caller, live or cached.
 */
@FunctionalInterface
public interface PayloadTransform {

    JsonNode apply(JsonNode payload);

    static PayloadTransform identity() {
        return payload -> payload;
    }
}
