package com.relaygate.api.controller;

import com.relaygate.api.dto.request.ChatCompletionRequest;
import com.relaygate.api.dto.response.ChatCompletionResponse;
import com.relaygate.api.dto.response.ModelListResponse;
import com.relaygate.api.exception.CompletionFailedException;
import com.relaygate.llm.model.CompletionRequest;
import com.relaygate.llm.model.ModelEntry;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.service.UnifiedLlmService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * OpenAI-compatible surface: chat completions and the model list.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Slf4j
public class ChatCompletionController {

    static final String PREFERRED_PROVIDER_HEADER = "X-Preferred-Provider";

    private final UnifiedLlmService llmService;

    @PostMapping("/chat/completions")
    public ResponseEntity<ChatCompletionResponse> chatCompletion(
            @Valid @RequestBody ChatCompletionRequest request,
            @RequestHeader(value = PREFERRED_PROVIDER_HEADER, required = false) String preferredHeader
    ) {
        String preferred = preferredHeader != null && !preferredHeader.isBlank() ? preferredHeader : request.getProvider();
        boolean force = Boolean.TRUE.equals(request.getForceProvider());

        log.info("[API] Chat completion | messages={} | model={} | preferred={} | force={}",
                request.getMessages().size(), request.getModel(), preferred, force);

        List<ChatMessage> messages = request.getMessages().stream()
                .map(m -> new ChatMessage(m.getRole(), m.getContent()))
                .toList();

        RequestOutcome outcome = llmService.complete(CompletionRequest.builder()
                .messages(messages)
                .model(request.getModel())
                .preferredProvider(preferred)
                .forceProvider(force)
                .build());

        if (!outcome.isSuccess()) {
            throw new CompletionFailedException(outcome);
        }

        ChatCompletionResponse response = ChatCompletionResponse.builder()
                .id("chatcmpl-" + UUID.randomUUID())
                .created(Instant.now().getEpochSecond())
                .model(outcome.getModelUsed())
                .provider(outcome.getProviderUsed())
                .responseTime(outcome.getResponseTimeSeconds())
                .choices(List.of(ChatCompletionResponse.Choice.builder()
                        .index(0)
                        .message(ChatCompletionResponse.Message.builder()
                                .role("assistant")
                                .content(outcome.getContent())
                                .build())
                        .finishReason("stop")
                        .build()))
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/models")
    public ResponseEntity<ModelListResponse> listModels() {
        List<ModelEntry> models = llmService.listModels();
        List<ModelListResponse.ModelInfo> data = models.stream()
                .map(entry -> ModelListResponse.ModelInfo.builder()
                        .id(entry.provider() + "/" + entry.model())
                        .ownedBy(entry.provider())
                        .build())
                .toList();
        return ResponseEntity.ok(ModelListResponse.builder().data(data).build());
    }
}
