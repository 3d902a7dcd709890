package com.linlay.analysisagent.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.ChatRequest;
import com.linlay.analysisagent.llm.model.LlmChunk;
import com.linlay.analysisagent.llm.model.LlmFunctionTool;
import com.linlay.analysisagent.llm.model.ToolCall;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiCompatibleClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldStreamTextAndToolCallsFromSseEndpoint() throws Exception {
        AtomicReference<String> requestBody = new AtomicReference<>();
        AtomicReference<String> authorization = new AtomicReference<>();
        String sse = """
                data: {"choices":[{"delta":{"content":"Loading "}}]}

                data: {"choices":[{"delta":{"content":"data"}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1","function":{"name":"run_code","arguments":"{\\"code\\":"}}]}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"\\"print(1)\\"}"}}]},"finish_reason":"tool_calls"}]}

                data: [DONE]

                """;
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = sse.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(bytes);
            }
        });
        server.start();
        try (OpenAiCompatibleClient client = new OpenAiCompatibleClient(
                settings("http://127.0.0.1:" + server.getAddress().getPort()),
                objectMapper, new LlmCallLogger(), Duration.ofSeconds(10))) {
            ChatRequest request = new ChatRequest(
                    List.of(ChatMessage.system("sys"), ChatMessage.note("chart", "hidden", Map.of()), ChatMessage.user("hi")),
                    List.of(new LlmFunctionTool("run_code", "run python", Map.of("type", "object"))),
                    0.2,
                    512
            );

            List<LlmChunk> chunks = client.streamChat(request).collectList().block(Duration.ofSeconds(10));

            assertThat(chunks).isNotNull();
            String text = chunks.stream().map(LlmChunk::text).collect(Collectors.joining());
            assertThat(text).isEqualTo("Loading data");
            List<ToolCall> calls = chunks.stream().flatMap(chunk -> chunk.toolCalls().stream()).toList();
            assertThat(calls).hasSize(1);
            assertThat(calls.get(0).id()).isEqualTo("call_1");
            assertThat(calls.get(0).name()).isEqualTo("run_code");
            assertThat(calls.get(0).arguments()).isEqualTo("{\"code\":\"print(1)\"}");

            JsonNode body = objectMapper.readTree(requestBody.get());
            assertThat(body.path("model").asText()).isEqualTo("test-model");
            assertThat(body.path("stream").asBoolean()).isTrue();
            assertThat(body.path("max_tokens").asInt()).isEqualTo(512);
            assertThat(body.path("messages").size()).isEqualTo(2);
            assertThat(body.path("tools").get(0).path("function").path("name").asText()).isEqualTo("run_code");
            assertThat(body.path("tool_choice").asText()).isEqualTo("auto");
            assertThat(body.has("stream_options")).isFalse();
            assertThat(authorization.get()).isEqualTo("Bearer sk-test");
        } finally {
            server.stop(0);
        }
    }

    @Test
    void shouldMapHttpErrorsToProviderException() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            exchange.getRequestBody().readAllBytes();
            byte[] bytes = "{\"error\":\"overloaded\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(503, bytes.length);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(bytes);
            }
        });
        server.start();
        try (OpenAiCompatibleClient client = new OpenAiCompatibleClient(
                settings("http://127.0.0.1:" + server.getAddress().getPort()),
                objectMapper, new LlmCallLogger(), Duration.ofSeconds(10))) {
            StepVerifier.create(client.streamChat(new ChatRequest(List.of(ChatMessage.user("hi")), List.of(), 0.2, 0)))
                    .expectErrorSatisfies(ex -> {
                        assertThat(ex).isInstanceOf(ProviderException.class);
                        assertThat(ex.getMessage()).startsWith("HTTP 503");
                        assertThat(((ProviderException) ex).providerId()).isEqualTo("test");
                    })
                    .verify(Duration.ofSeconds(10));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void shouldFailFastWithoutApiKey() {
        ProviderSettings missingKey = new ProviderSettings("test", "Test", ProviderProtocol.OPENAI_COMPATIBLE,
                "http://127.0.0.1:1", "", "test-model", false, true, null, Map.of());
        try (OpenAiCompatibleClient client = new OpenAiCompatibleClient(missingKey, objectMapper, new LlmCallLogger(), Duration.ofSeconds(1))) {
            StepVerifier.create(client.streamChat(new ChatRequest(List.of(ChatMessage.user("hi")), List.of(), 0.2, 0)))
                    .expectErrorMessage("Missing api-key for provider: test")
                    .verify(Duration.ofSeconds(5));
        }
    }

    @Test
    void shouldChooseCompletionsPathFromBaseUrl() {
        OpenAiCompatibleClient client = new OpenAiCompatibleClient(settings("http://x"), objectMapper, null, null);

        assertThat(client.completionsUri("https://api.deepseek.com/v1")).isEqualTo("/chat/completions");
        assertThat(client.completionsUri("https://open.bigmodel.cn/api/coding/paas/v4/")).isEqualTo("/chat/completions");
        assertThat(client.completionsUri("http://localhost:8080")).isEqualTo("/v1/chat/completions");
        client.close();
    }

    private ProviderSettings settings(String baseUrl) {
        return new ProviderSettings("test", "Test", ProviderProtocol.OPENAI_COMPATIBLE,
                baseUrl, "sk-test", "test-model", false, true, null, Map.of());
    }
}
