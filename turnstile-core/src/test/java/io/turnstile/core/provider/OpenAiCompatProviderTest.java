package io.turnstile.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.turnstile.core.content.ResponseNormalizer;
import io.turnstile.core.model.ChatMessage;
import io.turnstile.core.model.MessageContent;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseJsonCompletionWithToolCalls() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [{
                    "message": {
                      "content": "Checking.",
                      "tool_calls": [{
                        "id": "call_1",
                        "type": "function",
                        "function": {"name": "analyze_product", "arguments": "{\\"product_description\\":\\"a CRM\\"}"}
                      }]
                    }
                  }],
                  "usage": {"prompt_tokens": 3}
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openrouter",
            "sk-test",
            server.url("/api/v1").toString(),
            Map.of("X-Title", "turnstile"),
            1
        );

        LlmResponse response = provider.chat("some-model", List.of(ChatMessage.user("hi")), List.of());

        assertThat(ResponseNormalizer.leadingText(response.content())).isEqualTo("Checking.");
        assertThat(response.toolCalls()).hasSize(1);
        assertThat(response.toolCalls().get(0).id()).isEqualTo("call_1");
        assertThat(response.toolCalls().get(0).arguments()).containsEntry("product_description", "a CRM");
        assertThat(response.usage()).containsEntry("prompt_tokens", 3);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-Title")).isEqualTo("turnstile");
    }

    @Test
    void shouldReturnPlainTextWithoutToolCalls() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"Who is your customer?\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 1);

        LlmResponse response = provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo(MessageContent.text("Who is your customer?"));
        assertThat(response.hasToolCalls()).isFalse();
    }

    @Test
    void shouldAssembleStreamedToolCalls() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"content":"Let me "}}]}

                data: {"choices":[{"delta":{"content":"check."}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_a","function":{"name":"analyze_product","arguments":"{\\"product_"}}]}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"description\\":\\"x\\"}"}}]}}]}

                data: [DONE]

                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 1);

        LlmResponse response = provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of());

        assertThat(ResponseNormalizer.extractText(response.content())).isEqualTo("Let me check.");
        assertThat(response.toolCalls()).hasSize(1);
        assertThat(response.toolCalls().get(0).id()).isEqualTo("call_a");
        assertThat(response.toolCalls().get(0).name()).isEqualTo("analyze_product");
        assertThat(response.toolCalls().get(0).arguments()).containsEntry("product_description", "x");
    }

    @Test
    void shouldThrowWhenChoicesAreMissing() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 1);

        assertThatThrownBy(() -> provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOf(LlmProviderException.class)
            .hasMessageContaining("no choices");
    }

    @Test
    void shouldGiveUpAfterRepeatedRateLimits() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 2);

        assertThatThrownBy(() -> provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOf(LlmProviderException.class)
            .hasMessageContaining("HTTP 429");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }
}
