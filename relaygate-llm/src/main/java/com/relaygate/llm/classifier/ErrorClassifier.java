package com.relaygate.llm.classifier;

import java.util.List;
import java.util.Locale;

/**
 * Maps an upstream failure (message text, HTTP status, structured error body) to an {@link ErrorKind}.
 *
 * <p>Checks run in a fixed order and the first match wins: rate limit, auth, quota,
 * service unavailable, 5xx, network, 400, unknown. Status-derived 5xx classification runs
 * before the network phrase scan, so a 503 whose body says "timeout" is still
 * {@code service_unavailable}.</p>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    private static final List<String> RATE_LIMIT_PATTERNS = List.of(
            "rate limit", "too many requests", "quota exceeded", "requests per minute",
            "rpm exceeded", "rate limited", "throttled", "429", "rate_limit_exceeded",
            "requests_per_minute_limit_exceeded", "rate_limit_reached");

    private static final List<String> AUTH_ERROR_PATTERNS = List.of(
            "invalid key", "unauthorized", "forbidden", "api key", "invalid_api_key",
            "authentication failed", "invalid token", "access denied", "invalid_request_error",
            "incorrect api key", "api_key_invalid", "authentication_error");

    private static final List<String> QUOTA_PATTERNS = List.of(
            "daily limit", "monthly quota", "usage limit", "quota_exceeded", "insufficient_quota",
            "billing_hard_limit_reached", "usage_limit_exceeded", "credit limit", "balance insufficient");

    private static final List<String> SERVICE_PATTERNS = List.of(
            "model not found", "service unavailable", "model_not_found", "invalid_model",
            "model temporarily unavailable", "service_unavailable", "model_overloaded",
            "engine_overloaded", "server_overloaded", "overloaded");

    private static final List<String> NETWORK_PATTERNS = List.of(
            "timeout", "connection error", "network error", "connection timeout",
            "read timeout", "connect timeout", "connection refused", "network_error");

    private static final List<String> DAILY_LIMIT_PATTERNS = List.of(
            "daily limit", "per day", "daily quota", "requests per day", "requests_per_day");

    public static ErrorKind classify(String message, int status, Object body) {
        String corpus = corpus(message, body);

        if (containsAny(corpus, RATE_LIMIT_PATTERNS) || status == 429) {
            return ErrorKind.RATE_LIMIT;
        }
        if (containsAny(corpus, AUTH_ERROR_PATTERNS) || status == 401 || status == 403) {
            return ErrorKind.AUTH_ERROR;
        }
        if (containsAny(corpus, QUOTA_PATTERNS)) {
            return ErrorKind.QUOTA_EXCEEDED;
        }
        if (containsAny(corpus, SERVICE_PATTERNS) || status == 503) {
            return ErrorKind.SERVICE_UNAVAILABLE;
        }
        if (status >= 500 && status < 600) {
            return ErrorKind.SERVER_ERROR;
        }
        if (containsAny(corpus, NETWORK_PATTERNS)) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (status == 400) {
            return ErrorKind.BAD_REQUEST;
        }
        return ErrorKind.UNKNOWN;
    }

    public static ErrorKind classify(String message, int status) {
        return classify(message, status, null);
    }

    /**
     * True when the failure text describes a per-day allowance being used up, which
     * warrants a quarantine until midnight rather than a fixed cooldown.
     */
    public static boolean isDailyLimit(String message, Object body) {
        return containsAny(corpus(message, body), DAILY_LIMIT_PATTERNS);
    }

    private static String corpus(String message, Object body) {
        String text = message != null ? message.toLowerCase(Locale.ROOT) : "";
        if (body == null) {
            return text;
        }
        return text + " " + String.valueOf(body).toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String corpus, List<String> patterns) {
        for (String pattern : patterns) {
            if (corpus.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
