package com.relaygate.llm.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A model served by a provider, as discovered from its model listing endpoint.
 */
public record ModelEntry(
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model
) {
}
