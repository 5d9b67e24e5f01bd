package com.relaygate.llm.router;

import lombok.Builder;
import lombok.Value;

/**
 * Behaviour switches of one engine instance.
 */
@Value
@Builder
public class EngineSettings {

    public static final int DEFAULT_CONSECUTIVE_FAILURE_LIMIT = 5;

    @Builder.Default
    boolean keyRotationEnabled = true;
    @Builder.Default
    boolean providerRotationEnabled = true;
    @Builder.Default
    int consecutiveFailureLimit = DEFAULT_CONSECUTIVE_FAILURE_LIMIT;
    @Builder.Default
    boolean autodecideEnabled = true;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
