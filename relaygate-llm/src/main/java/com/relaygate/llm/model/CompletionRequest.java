package com.relaygate.llm.model;

import com.relaygate.llm.provider.ChatMessage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Input to {@code FailoverLlmRouter.complete}. With {@code forceProvider} set, only the
 * preferred provider is tried; otherwise the preferred provider just goes first.
 */
@Value
@Builder(toBuilder = true)
public class CompletionRequest {

    @Singular
    List<ChatMessage> messages;
    String model;
    String preferredProvider;
    boolean forceProvider;

    public static CompletionRequest of(List<ChatMessage> messages) {
        return CompletionRequest.builder().messages(messages).build();
    }

    public boolean hasPreferredProvider() {
        return preferredProvider != null && !preferredProvider.isBlank();
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
