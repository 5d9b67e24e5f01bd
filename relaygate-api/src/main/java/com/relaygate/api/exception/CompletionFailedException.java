package com.relaygate.api.exception;

import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.model.RequestOutcome;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Raised by controllers when the engine returns an unsuccessful outcome.
 */
@Getter
public class CompletionFailedException extends RuntimeException {

    private final transient RequestOutcome outcome;

    public CompletionFailedException(RequestOutcome outcome) {
        super(outcome.getErrorMessage());
        this.outcome = outcome;
    }

    /**
     * 503 when nothing could serve the request, 404 for an unknown provider, 502 for an
     * upstream failure surfaced directly.
     */
    public HttpStatus getStatus() {
        ErrorKind kind = outcome.getErrorKind();
        if (kind == null) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (kind == ErrorKind.NO_PROVIDERS || kind == ErrorKind.ALL_FAILED || kind == ErrorKind.PROVIDER_FLAGGED) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (kind == ErrorKind.PROVIDER_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
