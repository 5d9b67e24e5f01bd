package com.relaygate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.relaygate.llm.classifier.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized result of one provider attempt, or of a whole engine call.
 * Failures are always returned as an outcome, never thrown.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestOutcome {

    boolean success;
    @Builder.Default
    String content = "";
    int statusCode;
    double responseTimeSeconds;
    @Builder.Default
    String errorMessage = "";
    ErrorKind errorKind;
    String providerUsed;
    String modelUsed;
    JsonNode rawResponse;

    public static RequestOutcome success(String content, int statusCode, JsonNode rawResponse) {
        return RequestOutcome.builder()
                .success(true)
                .content(content)
                .statusCode(statusCode)
                .rawResponse(rawResponse)
                .build();
    }

    public static RequestOutcome failure(ErrorKind kind, String message) {
        return RequestOutcome.builder()
                .success(false)
                .errorKind(kind)
                .errorMessage(message != null ? message : "")
                .build();
    }

    public static RequestOutcome failure(ErrorKind kind, String message, int statusCode, JsonNode rawResponse) {
        return RequestOutcome.builder()
                .success(false)
                .errorKind(kind)
                .errorMessage(message != null ? message : "")
                .statusCode(statusCode)
                .rawResponse(rawResponse)
                .build();
    }

    public boolean hasErrorKind(ErrorKind kind) {
        return errorKind == kind;
    }
}
