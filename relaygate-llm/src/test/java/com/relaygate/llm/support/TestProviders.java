package com.relaygate.llm.support;

import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;

import java.time.Duration;
import java.util.List;

/**
 * Provider configurations and outcomes shared by the engine tests.
 */
public final class TestProviders {

    private TestProviders() {
    }

    public static ProviderConfig openAi(String id, int priority, String... keys) {
        return ProviderConfig.builder()
                .id(id)
                .priority(priority)
                .format(ProviderFormat.OPENAI)
                .endpoint("https://" + id + ".example/v1/chat/completions")
                .model(id + "-default")
                .apiKeys(List.of(keys))
                .authType("bearer")
                .timeout(Duration.ofSeconds(5))
                .build();
    }

    public static RequestOutcome ok(String content) {
        return RequestOutcome.success(content, 200, null);
    }

    public static RequestOutcome rateLimited() {
        return RequestOutcome.failure(ErrorKind.RATE_LIMIT, "{\"error\":\"rate limit exceeded\"}", 429, null);
    }

    public static RequestOutcome unknownFailure() {
        return RequestOutcome.failure(ErrorKind.UNKNOWN, "something odd happened", 418, null);
    }

    public static RequestOutcome serverError() {
        return RequestOutcome.failure(ErrorKind.SERVER_ERROR, "internal error", 500, null);
    }
}
