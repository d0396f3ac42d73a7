package dev.evalkit.provider;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.embeddings.EmbeddingCreateParams;
import dev.evalkit.config.EvalKitConfig;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * OpenAI-backed chat completions and embeddings.
 *
 * <p>The client's own retries are disabled; the runner owns retry and backoff.
 */
@Slf4j
public final class OpenAIProvider implements ModelProvider, EmbeddingProvider {
    private final OpenAIClient client;

    OpenAIProvider(OpenAIClient client) {
        this.client = client;
    }

    /**
     * @throws EvalException of kind CONFIGURATION when no API key is configured
     */
    public static OpenAIProvider of(EvalKitConfig config) {
        var builder =
                OpenAIOkHttpClient.builder()
                        .apiKey(config.openAiApiKey())
                        .maxRetries(0)
                        .timeout(config.requestTimeout());
        config.openAiBaseUrl().ifPresent(builder::baseUrl);
        return new OpenAIProvider(builder.build());
    }

    @Override
    public ModelResponse complete(ModelRequest request) {
        var modelConfig = request.config();
        var params = ChatCompletionCreateParams.builder().model(modelConfig.model());
        if (request.systemPrompt() != null) {
            params.addSystemMessage(request.systemPrompt());
        }
        params.addUserMessage(request.prompt())
                .temperature(modelConfig.temperature())
                .maxTokens(modelConfig.maxTokens().longValue());
        try {
            var completion = client.chat().completions().create(params.build());
            var text =
                    completion.choices().isEmpty()
                            ? ""
                            : completion.choices().get(0).message().content().orElse("");
            long promptTokens = completion.usage().map(u -> u.promptTokens()).orElse(0L);
            long completionTokens = completion.usage().map(u -> u.completionTokens()).orElse(0L);
            return new ModelResponse(text, promptTokens, completionTokens);
        } catch (OpenAIServiceException e) {
            throw translate(modelConfig.model(), e);
        } catch (OpenAIIoException e) {
            throw translate(modelConfig.model(), e);
        }
    }

    @Override
    public double[] embed(String text, String model) {
        var params =
                EmbeddingCreateParams.builder()
                        .model(model)
                        .input(text)
                        .encodingFormat(EmbeddingCreateParams.EncodingFormat.FLOAT)
                        .build();
        try {
            var response = client.embeddings().create(params);
            if (response.data().isEmpty()) {
                throw EvalException.of(
                        ErrorKind.MODEL_REJECTED,
                        "embedding response for model %s contained no data".formatted(model),
                        Map.of("model", model));
            }
            return response.data().get(0).embedding().stream()
                    .mapToDouble(Number::doubleValue)
                    .toArray();
        } catch (OpenAIServiceException e) {
            throw translate(model, e);
        } catch (OpenAIIoException e) {
            throw translate(model, e);
        }
    }

    static EvalException translate(String model, OpenAIServiceException e) {
        int status = e.statusCode();
        log.debug("OpenAI request for {} failed with status {}", model, status, e);
        var context = Map.<String, Object>of("model", model, "status", status);
        if (status == 429) {
            return EvalException.rateLimited(model, retryAfter(e), e);
        } else if (status == 401 || status == 403) {
            return EvalException.of(
                    ErrorKind.MODEL_AUTHENTICATION,
                    "provider rejected credentials (status %d)".formatted(status),
                    context,
                    e);
        } else if (status == 408) {
            return EvalException.of(
                    ErrorKind.MODEL_TIMEOUT, "provider request timed out", context, e);
        } else if (status >= 500) {
            return EvalException.of(
                    ErrorKind.MODEL_UNAVAILABLE,
                    "provider error (status %d): %s".formatted(status, e.getMessage()),
                    context,
                    e);
        }
        return EvalException.of(
                ErrorKind.MODEL_REJECTED,
                "provider rejected request (status %d): %s".formatted(status, e.getMessage()),
                context,
                e);
    }

    static EvalException translate(String model, OpenAIIoException e) {
        log.debug("OpenAI request for {} failed with I/O error", model, e);
        var kind =
                e.getCause() instanceof InterruptedIOException
                        ? ErrorKind.MODEL_TIMEOUT
                        : ErrorKind.MODEL_UNAVAILABLE;
        return EvalException.of(
                kind, "network error: " + e.getMessage(), Map.of("model", model), e);
    }

    private static @Nullable Duration retryAfter(OpenAIServiceException e) {
        var values = e.headers().values("retry-after");
        if (values.isEmpty()) {
            return null;
        }
        try {
            return Duration.ofMillis((long) (Double.parseDouble(values.get(0).trim()) * 1000));
        } catch (NumberFormatException ignored) {
            // HTTP-date values fall back to exponential backoff
            return null;
        }
    }
}
