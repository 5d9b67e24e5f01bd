package com.relaygate.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Error body for every non-2xx answer. {@code errorKind} carries the engine's failure kind
 * when the error comes from a failed completion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String error;
    private String message;
    private String errorKind;
    private String provider;
    private Integer status;
    private Instant timestamp;
    private String path;
}
