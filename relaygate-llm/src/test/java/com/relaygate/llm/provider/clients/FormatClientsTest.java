package com.relaygate.llm.provider.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import com.relaygate.llm.support.TestProviders;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Each wire format against a stubbed HTTP exchange: request shape, content extraction
 * and failure mapping.
 */
class FormatClientsTest {

    private static final List<ChatMessage> MESSAGES = List.of(
            ChatMessage.system("be brief"),
            ChatMessage.user("hello there"));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();

    private WebClient.Builder respondingWith(HttpStatus status, String body) {
        return WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
    }

    private WebClient.Builder using(ExchangeFunction exchange) {
        return WebClient.builder().exchangeFunction(exchange);
    }

    @Test
    void openAiExtractsChoiceContent() {
        OpenAiFormatClient client = new OpenAiFormatClient(respondingWith(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"hi!\"}}]}"), objectMapper);

        RequestOutcome outcome = client.send(TestProviders.openAi("groq", 1, "k1"), "k1", MESSAGES, "llama3").block();

        assertNotNull(outcome);
        assertTrue(outcome.isSuccess());
        assertEquals("hi!", outcome.getContent());
        assertEquals(200, outcome.getStatusCode());
        assertEquals("llama3", outcome.getModelUsed());
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("https://groq.example/v1/chat/completions", request.url().toString());
        assertEquals("Bearer k1", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void openAiRateLimitKeepsStatusAndBody() {
        OpenAiFormatClient client = new OpenAiFormatClient(respondingWith(HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"message\":\"Rate limit reached for requests\",\"code\":\"rate_limit_exceeded\"}}"), objectMapper);

        RequestOutcome outcome = client.send(TestProviders.openAi("groq", 1, "k1"), "k1", MESSAGES, null).block();

        assertNotNull(outcome);
        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.RATE_LIMIT, outcome.getErrorKind());
        assertEquals(429, outcome.getStatusCode());
        assertEquals("rate_limit_exceeded", outcome.getRawResponse().path("error").path("code").asText());
        assertEquals("groq-default", outcome.getModelUsed());
    }

    @Test
    void serverErrorWithoutBodyGetsSyntheticMessage() {
        OpenAiFormatClient client = new OpenAiFormatClient(respondingWith(HttpStatus.BAD_GATEWAY, ""), objectMapper);

        RequestOutcome outcome = client.send(TestProviders.openAi("groq", 1, "k1"), "k1", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals(ErrorKind.SERVER_ERROR, outcome.getErrorKind());
        assertTrue(outcome.getErrorMessage().startsWith("groq API error: 502"));
    }

    @Test
    void blankContentIsEmptyResponse() {
        OpenAiFormatClient client = new OpenAiFormatClient(respondingWith(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"content\":\"  \"}}]}"), objectMapper);

        RequestOutcome outcome = client.send(TestProviders.openAi("groq", 1, "k1"), "k1", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals(ErrorKind.EMPTY_RESPONSE, outcome.getErrorKind());
        assertEquals(200, outcome.getStatusCode());
    }

    @Test
    void unparseableSuccessBodyIsRequestException() {
        OpenAiFormatClient client = new OpenAiFormatClient(respondingWith(HttpStatus.OK, "<html>oops</html>"), objectMapper);

        RequestOutcome outcome = client.send(TestProviders.openAi("groq", 1, "k1"), "k1", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals(ErrorKind.REQUEST_EXCEPTION, outcome.getErrorKind());
    }

    @Test
    void slowProviderTimesOut() {
        OpenAiFormatClient client = new OpenAiFormatClient(using(request -> Mono.never()), objectMapper);
        ProviderConfig provider = TestProviders.openAi("groq", 1, "k1").toBuilder()
                .timeout(Duration.ofMillis(100))
                .build();

        RequestOutcome outcome = client.send(provider, "k1", MESSAGES, null).block(Duration.ofSeconds(5));

        assertNotNull(outcome);
        assertEquals(ErrorKind.TIMEOUT, outcome.getErrorKind());
        assertEquals("Request timeout", outcome.getErrorMessage());
    }

    @Test
    void connectionFailureIsRequestException() {
        OpenAiFormatClient client = new OpenAiFormatClient(
                using(request -> Mono.error(new IllegalStateException("Connection refused"))), objectMapper);

        RequestOutcome outcome = client.send(TestProviders.openAi("groq", 1, "k1"), "k1", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals(ErrorKind.REQUEST_EXCEPTION, outcome.getErrorKind());
        assertEquals("Connection refused", outcome.getErrorMessage());
    }

    @Test
    void geminiSendsKeyInUrlAndReadsCandidate() {
        GeminiFormatClient client = new GeminiFormatClient(respondingWith(HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"gemini says hi\"}]}}]}"), objectMapper);
        ProviderConfig gemini = TestProviders.openAi("gemini", 1, "g-key").toBuilder()
                .format(ProviderFormat.GEMINI)
                .authType("key")
                .endpoint("https://gemini.example/v1beta/models/{model}:generateContent")
                .build();

        RequestOutcome outcome = client.send(gemini, "g-key", MESSAGES, "gemini-1.5-flash").block();

        assertNotNull(outcome);
        assertEquals("gemini says hi", outcome.getContent());
        ClientRequest request = requests.get(0);
        assertEquals("/v1beta/models/gemini-1.5-flash:generateContent", request.url().getPath());
        assertEquals("key=g-key", request.url().getQuery());
        assertFalse(request.headers().containsKey(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void cohereUsesLowercaseBearerAndReadsMessageText() {
        CohereFormatClient client = new CohereFormatClient(respondingWith(HttpStatus.OK,
                "{\"message\":{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":\"cohere here\"}]}}"), objectMapper);
        ProviderConfig cohere = TestProviders.openAi("cohere", 1, "c-key").toBuilder()
                .format(ProviderFormat.COHERE)
                .build();

        RequestOutcome outcome = client.send(cohere, "c-key", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals("cohere here", outcome.getContent());
        assertEquals("bearer c-key", requests.get(0).headers().getFirst("authorization"));
    }

    @Test
    void cohereWithoutModelStillSends() {
        CohereFormatClient client = new CohereFormatClient(respondingWith(HttpStatus.OK,
                "{\"message\":{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":\"no model needed\"}]}}"), objectMapper);
        ProviderConfig cohere = TestProviders.openAi("co", 1, "c-key").toBuilder()
                .format(ProviderFormat.COHERE)
                .model(null)
                .build();

        RequestOutcome outcome = client.send(cohere, "c-key", MESSAGES, null).block();

        assertNotNull(outcome);
        assertTrue(outcome.isSuccess());
        assertEquals("no model needed", outcome.getContent());
        assertEquals(1, requests.size());
    }

    @Test
    void geminiToleratesMessageWithoutContent() {
        GeminiFormatClient client = new GeminiFormatClient(respondingWith(HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"still answered\"}]}}]}"), objectMapper);
        ProviderConfig gemini = TestProviders.openAi("gemini", 1, "g-key").toBuilder()
                .format(ProviderFormat.GEMINI)
                .authType("key")
                .endpoint("https://gemini.example/v1beta/models/{model}:generateContent")
                .build();

        RequestOutcome outcome = client.send(gemini, "g-key",
                List.of(new ChatMessage("user", null)), "gemini-1.5-flash").block();

        assertNotNull(outcome);
        assertEquals("still answered", outcome.getContent());
    }

    @Test
    void queryGetAcceptsPlainTextAndSendsLastMessage() {
        QueryGetFormatClient client = new QueryGetFormatClient(respondingWith(HttpStatus.OK, "plain answer"), objectMapper);
        ProviderConfig open = TestProviders.openAi("a3z", 1).toBuilder()
                .format(ProviderFormat.QUERY_GET)
                .authType(null)
                .endpoint("https://a3z.example/api")
                .build();

        RequestOutcome outcome = client.send(open, null, MESSAGES, "gpt-4o").block();

        assertNotNull(outcome);
        assertTrue(outcome.isSuccess());
        assertEquals("plain answer", outcome.getContent());
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.GET, request.method());
        assertTrue(request.url().getQuery().contains("user=hello there"));
        assertTrue(request.url().getQuery().contains("model=gpt-4o"));
    }

    @Test
    void queryGetReadsJsonEnvelope() {
        QueryGetFormatClient client = new QueryGetFormatClient(respondingWith(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"content\":\"json answer\"}}]}"), objectMapper);
        ProviderConfig open = TestProviders.openAi("a3z", 1).toBuilder()
                .format(ProviderFormat.QUERY_GET)
                .authType(null)
                .build();

        RequestOutcome outcome = client.send(open, null, MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals("json answer", outcome.getContent());
    }

    @Test
    void cloudflareWithoutAccountFailsWithoutCall() {
        CloudflareFormatClient client = new CloudflareFormatClient(respondingWith(HttpStatus.OK, "{}"), objectMapper);
        ProviderConfig cloudflare = TestProviders.openAi("cloudflare", 1, "cf-key").toBuilder()
                .format(ProviderFormat.CLOUDFLARE)
                .endpoint("https://api.cloudflare.example/client/v4/accounts/{account_id}/ai/v1/chat/completions")
                .build();

        RequestOutcome outcome = client.send(cloudflare, "cf-key", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals(ErrorKind.CONFIG_ERROR, outcome.getErrorKind());
        assertTrue(requests.isEmpty());
    }

    @Test
    void cloudflareWithoutModelFailsWithoutCall() {
        CloudflareFormatClient client = new CloudflareFormatClient(respondingWith(HttpStatus.OK, "{}"), objectMapper);
        ProviderConfig cloudflare = TestProviders.openAi("cloudflare", 1, "cf-key").toBuilder()
                .format(ProviderFormat.CLOUDFLARE)
                .accountId("acc123")
                .model(null)
                .endpoint("https://api.cloudflare.example/client/v4/accounts/{account_id}/ai/run/{model}")
                .build();

        RequestOutcome outcome = client.send(cloudflare, "cf-key", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals(ErrorKind.CONFIG_ERROR, outcome.getErrorKind());
        assertEquals("cloudflare", outcome.getProviderUsed());
        assertTrue(requests.isEmpty());
    }

    @Test
    void cloudflareTemplatesAccountIntoPath() {
        CloudflareFormatClient client = new CloudflareFormatClient(respondingWith(HttpStatus.OK,
                "{\"result\":{\"response\":\"worker output\"},\"success\":true}"), objectMapper);
        ProviderConfig cloudflare = TestProviders.openAi("cloudflare", 1, "cf-key").toBuilder()
                .format(ProviderFormat.CLOUDFLARE)
                .accountId("acc123")
                .endpoint("https://api.cloudflare.example/client/v4/accounts/{account_id}/ai/v1/chat/completions")
                .build();

        RequestOutcome outcome = client.send(cloudflare, "cf-key", MESSAGES, null).block();

        assertNotNull(outcome);
        assertEquals("worker output", outcome.getContent());
        assertEquals("/client/v4/accounts/acc123/ai/v1/chat/completions", requests.get(0).url().getPath());
        assertEquals("Bearer cf-key", requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }
}
