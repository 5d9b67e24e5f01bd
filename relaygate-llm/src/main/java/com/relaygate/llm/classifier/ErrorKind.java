package com.relaygate.llm.classifier;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure taxonomy shared by the classifier, the remediation policy and callers.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    // Upstream semantic errors, produced by ErrorClassifier
    RATE_LIMIT("rate_limit"),
    AUTH_ERROR("auth_error"),
    QUOTA_EXCEEDED("quota_exceeded"),
    DAILY_LIMIT("daily_limit"),
    SERVICE_UNAVAILABLE("service_unavailable"),
    SERVER_ERROR("server_error"),
    NETWORK_ERROR("network_error"),
    BAD_REQUEST("bad_request"),
    UNKNOWN("unknown"),

    // Transport and content validation
    TIMEOUT("timeout"),
    REQUEST_EXCEPTION("request_exception"),
    EMPTY_RESPONSE("empty_response"),

    // Engine level
    NO_PROVIDERS("no_providers"),
    ALL_FAILED("all_failed"),
    PROVIDER_NOT_FOUND("provider_not_found"),
    PROVIDER_FLAGGED("provider_flagged"),
    CONFIG_ERROR("config_error"),
    UNSUPPORTED_FORMAT("unsupported_format");

    private final String code;

    @JsonValue
    public String code() {
        return code;
    }

    /** Errors that point at the credential rather than the provider. */
    public boolean isCredentialLevel() {
        return this == RATE_LIMIT || this == AUTH_ERROR || this == QUOTA_EXCEEDED || this == DAILY_LIMIT;
    }

    /** Errors that point at a provider-wide outage. */
    public boolean isProviderOutage() {
        return this == SERVICE_UNAVAILABLE || this == SERVER_ERROR || this == NETWORK_ERROR;
    }

    @Override
    public String toString() {
        return code;
    }
}
