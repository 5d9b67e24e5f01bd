package com.relaygate.llm.provider.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.classifier.ErrorClassifier;
import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.FormatAdapter;
import com.relaygate.llm.provider.ProviderConfig;
import io.netty.channel.ConnectTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Shared plumbing for the format clients: timeout, status mapping, empty-content
 * detection and logging. Subclasses build the request and say where the text lives.
 */
@Slf4j
public abstract class AbstractFormatClient implements FormatAdapter {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;

    protected AbstractFormatClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder.clone()
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    /**
     * Pulls the completion text out of a parsed 2xx body. Returns an empty string when absent.
     */
    protected abstract String extractContent(JsonNode root);

    protected Mono<RequestOutcome> exchange(ProviderConfig provider, String model,
                                            Supplier<Mono<ResponseEntity<String>>> call) {
        String tag = "[" + getFormat().name() + "]";
        return Mono.defer(() -> {
            long startTime = System.currentTimeMillis();
            log.debug("{} Sending request | provider={} | model={} | timeoutMs={}",
                    tag, provider.getId(), model, provider.effectiveTimeout().toMillis());

            return call.get()
                    .timeout(provider.effectiveTimeout())
                    .map(response -> toOutcome(provider, response.getStatusCode().value(),
                            response.getBody() != null ? response.getBody() : ""))
                    .defaultIfEmpty(RequestOutcome.failure(ErrorKind.EMPTY_RESPONSE,
                            "Empty response from " + provider.getId()))
                    .onErrorResume(WebClientResponseException.class, e -> Mono.just(httpFailure(provider, e)))
                    .onErrorResume(e -> Mono.just(transportFailure(provider, e)))
                    .map(outcome -> {
                        long duration = System.currentTimeMillis() - startTime;
                        if (outcome.isSuccess()) {
                            log.info("{} Content generated successfully | provider={} | model={} | durationMs={} | responseLength={}",
                                    tag, provider.getId(), model, duration, outcome.getContent().length());
                        } else {
                            log.warn("{} Request failed | provider={} | model={} | statusCode={} | kind={} | durationMs={}",
                                    tag, provider.getId(), model, outcome.getStatusCode(), outcome.getErrorKind(), duration);
                        }
                        return outcome.toBuilder()
                                .modelUsed(model)
                                .responseTimeSeconds(duration / 1000.0)
                                .build();
                    });
        });
    }

    /**
     * Turns a 2xx body into an outcome. A body with no usable text is a failure.
     */
    protected RequestOutcome toOutcome(ProviderConfig provider, int status, String body) {
        JsonNode root = readJson(body);
        if (root == null) {
            return RequestOutcome.failure(ErrorKind.REQUEST_EXCEPTION,
                    "Failed to parse response from " + provider.getId(), status, null);
        }
        return contentOutcome(provider, status, extractContent(root), root);
    }

    protected RequestOutcome contentOutcome(ProviderConfig provider, int status, String content, JsonNode raw) {
        if (content == null || content.isBlank()) {
            return RequestOutcome.failure(ErrorKind.EMPTY_RESPONSE,
                    "Empty response from " + provider.getId(), status, raw);
        }
        return RequestOutcome.success(content, status, raw);
    }

    protected RequestOutcome httpFailure(ProviderConfig provider, WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        JsonNode errorJson = readJson(body);
        String message = body != null && !body.isBlank()
                ? body
                : String.format("%s API error: %d %s", provider.getId(), status, e.getStatusText());

        ErrorKind kind = ErrorClassifier.classify(message, status, errorJson);
        return RequestOutcome.failure(kind, message, status, errorJson);
    }

    protected RequestOutcome transportFailure(ProviderConfig provider, Throwable e) {
        if (isTimeout(e)) {
            return RequestOutcome.failure(ErrorKind.TIMEOUT, "Request timeout");
        }
        String message = rootMessage(e);
        log.debug("[{}] Transport failure | provider={} | error={}", getFormat().name(), provider.getId(), message);
        return RequestOutcome.failure(ErrorKind.REQUEST_EXCEPTION, message);
    }

    protected JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    protected static String bearer(String credential) {
        return "Bearer " + credential;
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof io.netty.handler.timeout.TimeoutException
                    || t instanceof ConnectTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getMessage();
        }
        return message != null ? message : error.getClass().getSimpleName();
    }
}
