package com.relaygate.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Wire formats a provider can speak. Each format maps to exactly one {@link FormatAdapter}.
 */
@Getter
@RequiredArgsConstructor
public enum ProviderFormat {

    OPENAI("openai"),       // Bearer token, OpenAI-compatible chat completions
    GEMINI("gemini"),       // Key in URL, single-shot generateContent
    COHERE("cohere"),       // Message array, lowercase authorization header
    QUERY_GET("a3z_get"),   // GET with user/model query parameters
    CLOUDFLARE("cloudflare"); // Account id templated into the endpoint path

    private final String code;

    public static ProviderFormat fromString(String name) {
        for (ProviderFormat format : values()) {
            if (format.name().equalsIgnoreCase(name) || format.getCode().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown provider format: " + name);
    }
}
