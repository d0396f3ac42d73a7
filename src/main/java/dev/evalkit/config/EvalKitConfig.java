package dev.evalkit.config;

import dev.evalkit.EvalKitUtils;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Process-level settings read from environment variables.
 *
 * <p>Any variable can be overridden during construction, which is how tests configure the engine.
 * Provider credentials are only read when a component needs them, so commands that never call a
 * model work without an API key.
 */
@Getter
@Accessors(fluent = true)
public final class EvalKitConfig extends BaseConfig {
    public static final String OPENAI_API_KEY = "OPENAI_API_KEY";

    private final Optional<String> openAiBaseUrl =
            Optional.ofNullable(getConfig("OPENAI_BASE_URL", null, String.class));
    private final Optional<String> dashboardUrl =
            Optional.ofNullable(getConfig("EVALKIT_DASHBOARD_URL", null, String.class));
    private final boolean debug = getConfig("EVALKIT_DEBUG", false);
    private final Duration requestTimeout =
            Duration.ofSeconds(getConfig("EVALKIT_REQUEST_TIMEOUT", 60));
    private final String datasetsDir = getConfig("EVALKIT_DATASETS_DIR", "datasets");
    /** Where runs and baselines are kept. Unset keeps them in memory. */
    private final Optional<String> storageDir =
            Optional.ofNullable(getConfig("EVALKIT_STORAGE_DIR", null, String.class));
    private final Optional<String> alertWebhookUrl =
            Optional.ofNullable(getConfig("EVALKIT_ALERT_WEBHOOK_URL", null, String.class));
    private final String emailApiUrl =
            getConfig("EVALKIT_ALERT_EMAIL_API_URL", "https://api.resend.com/emails");
    private final Optional<String> emailApiKey =
            Optional.ofNullable(getConfig("EVALKIT_ALERT_EMAIL_API_KEY", null, String.class));
    private final String emailFrom = getConfig("EVALKIT_ALERT_EMAIL_FROM", "evalkit@localhost");
    private final List<String> emailTo =
            EvalKitUtils.parseCsv(getConfig("EVALKIT_ALERT_EMAIL_TO", ""));

    public static EvalKitConfig fromEnvironment() {
        return of();
    }

    public static EvalKitConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new EvalKitConfig(overridesMap);
    }

    private EvalKitConfig(Map<String, String> envOverrides) {
        super(envOverrides);
    }

    /**
     * @throws dev.evalkit.error.EvalException of kind CONFIGURATION if {@value #OPENAI_API_KEY} is
     *     not set
     */
    public String openAiApiKey() {
        return getRequiredConfig(OPENAI_API_KEY);
    }

    public boolean hasOpenAiApiKey() {
        return getConfig(OPENAI_API_KEY, null, String.class) != null;
    }

    /** Email alerts are enabled once a key and at least one recipient are configured. */
    public boolean emailAlertsEnabled() {
        return emailApiKey.isPresent() && !emailTo.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder openAiApiKey(String value) {
            return put(OPENAI_API_KEY, value);
        }

        public Builder openAiBaseUrl(String value) {
            return put("OPENAI_BASE_URL", value);
        }

        public Builder dashboardUrl(String value) {
            return put("EVALKIT_DASHBOARD_URL", value);
        }

        public Builder debug(boolean value) {
            return put("EVALKIT_DEBUG", String.valueOf(value));
        }

        public Builder requestTimeout(Duration value) {
            return put("EVALKIT_REQUEST_TIMEOUT", String.valueOf(value.getSeconds()));
        }

        public Builder datasetsDir(String value) {
            return put("EVALKIT_DATASETS_DIR", value);
        }

        public Builder storageDir(String value) {
            return put("EVALKIT_STORAGE_DIR", value);
        }

        public Builder alertWebhookUrl(String value) {
            return put("EVALKIT_ALERT_WEBHOOK_URL", value);
        }

        public Builder emailApiUrl(String value) {
            return put("EVALKIT_ALERT_EMAIL_API_URL", value);
        }

        public Builder emailApiKey(String value) {
            return put("EVALKIT_ALERT_EMAIL_API_KEY", value);
        }

        public Builder emailFrom(String value) {
            return put("EVALKIT_ALERT_EMAIL_FROM", value);
        }

        public Builder emailTo(String... recipients) {
            return put("EVALKIT_ALERT_EMAIL_TO", String.join(",", recipients));
        }

        private Builder put(String key, String value) {
            envOverrides.put(key, value != null ? value : NULL_OVERRIDE);
            return this;
        }

        public EvalKitConfig build() {
            return new EvalKitConfig(envOverrides);
        }
    }
}
