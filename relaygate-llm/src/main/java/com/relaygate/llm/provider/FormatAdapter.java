package com.relaygate.llm.provider;

import com.relaygate.llm.model.RequestOutcome;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Translates a normalized chat request into one provider wire format and back.
 *
 * <p>Implementations never signal an error on the returned {@link Mono}: every failure
 * (HTTP status, timeout, transport, unusable content, bad configuration) is emitted as an
 * unsuccessful {@link RequestOutcome}. Disposing the subscription cancels the in-flight call.</p>
 */
public interface FormatAdapter {

    ProviderFormat getFormat();

    /**
     * @param credential API key to use, or null for providers without auth
     * @param model requested model, or null for the provider's configured default
     */
    Mono<RequestOutcome> send(ProviderConfig provider, String credential, List<ChatMessage> messages, String model);
}
