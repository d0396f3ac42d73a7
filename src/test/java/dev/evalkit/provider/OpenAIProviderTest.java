package dev.evalkit.provider;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import dev.evalkit.config.EvalKitConfig;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class OpenAIProviderTest {

    @RegisterExtension
    static WireMockExtension wireMock =
            WireMockExtension.newInstance().options(wireMockConfig().dynamicPort()).build();

    private OpenAIProvider provider;

    @BeforeEach
    void beforeEach() {
        wireMock.resetAll();
        var config =
                EvalKitConfig.builder()
                        .openAiApiKey("test-key")
                        .openAiBaseUrl("http://localhost:" + wireMock.getPort() + "/v1")
                        .requestTimeout(Duration.ofSeconds(5))
                        .build();
        provider = OpenAIProvider.of(config);
    }

    @Test
    void completesChat() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .withHeader("Authorization", equalTo("Bearer test-key"))
                        .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini")))
                        .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
                        .withRequestBody(
                                matchingJsonPath("$.messages[1].content", equalTo("2 + 2?")))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                """
                                {
                                  "id": "chatcmpl-1",
                                  "object": "chat.completion",
                                  "created": 1741608000,
                                  "model": "gpt-4o-mini",
                                  "choices": [
                                    {
                                      "index": 0,
                                      "message": {"role": "assistant", "content": "4"},
                                      "logprobs": null,
                                      "finish_reason": "stop"
                                    }
                                  ],
                                  "usage": {
                                    "prompt_tokens": 12,
                                    "completion_tokens": 1,
                                    "total_tokens": 13
                                  }
                                }
                                """)));

        var response =
                provider.complete(
                        new ModelRequest(
                                ModelConfig.of("gpt-4o-mini"), "Answer briefly.", "2 + 2?"));

        assertEquals("4", response.text());
        assertEquals(12, response.promptTokens());
        assertEquals(1, response.completionTokens());
    }

    @Test
    void embeds() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/embeddings"))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                """
                                {
                                  "object": "list",
                                  "data": [
                                    {"object": "embedding", "index": 0, "embedding": [0.5, -0.25]}
                                  ],
                                  "model": "text-embedding-3-small",
                                  "usage": {"prompt_tokens": 2, "total_tokens": 2}
                                }
                                """)));

        var vector = provider.embed("hello", "text-embedding-3-small");

        assertArrayEquals(new double[] {0.5, -0.25}, vector, 1e-6);
    }

    @Test
    void rateLimitIsRetryableWithHint() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(
                                aResponse()
                                        .withStatus(429)
                                        .withHeader("Content-Type", "application/json")
                                        .withHeader("retry-after", "2")
                                        .withBody("{\"error\": {\"message\": \"slow down\"}}")));

        var error = assertThrows(EvalException.class, this::ask);

        assertEquals(ErrorKind.MODEL_RATE_LIMITED, error.kind());
        assertTrue(error.retryable());
        assertEquals(Duration.ofSeconds(2), error.retryAfter().orElseThrow());
        wireMock.verify(1, postRequestedFor(urlEqualTo("/v1/chat/completions")));
    }

    @Test
    void badCredentialsAreNotRetryable() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(
                                aResponse()
                                        .withStatus(401)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody("{\"error\": {\"message\": \"bad key\"}}")));

        var error = assertThrows(EvalException.class, this::ask);

        assertEquals(ErrorKind.MODEL_AUTHENTICATION, error.kind());
        assertFalse(error.retryable());
        assertEquals(401, error.context().get("status"));
    }

    @Test
    void serverErrorsAreUnavailable() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(
                                aResponse()
                                        .withStatus(503)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody("{\"error\": {\"message\": \"overloaded\"}}")));

        var error = assertThrows(EvalException.class, this::ask);

        assertEquals(ErrorKind.MODEL_UNAVAILABLE, error.kind());
        assertTrue(error.retryable());
    }

    @Test
    void missingApiKeyIsAConfigurationError() {
        var config = EvalKitConfig.builder().openAiApiKey(null).build();
        var error = assertThrows(EvalException.class, () -> OpenAIProvider.of(config));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
    }

    private ModelResponse ask() {
        return provider.complete(new ModelRequest(ModelConfig.of("gpt-4o-mini"), null, "hi"));
    }
}
