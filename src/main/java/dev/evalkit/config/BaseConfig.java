package dev.evalkit.config;

import dev.evalkit.error.EvalException;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Typed lookups of environment settings, with an override map for tests and embedding. */
class BaseConfig {
    /** Override value that hides a variable set in the real environment. */
    static final String NULL_OVERRIDE = "EVALKIT_NULL_SENTINEL_" + System.currentTimeMillis();

    protected final Map<String, String> envOverrides;

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    @SuppressWarnings("unchecked")
    protected <T> @Nonnull T getConfig(@Nonnull String settingName, @Nonnull T defaultValue) {
        Objects.requireNonNull(defaultValue);
        return Objects.requireNonNull(
                getConfig(settingName, defaultValue, (Class<T>) defaultValue.getClass()));
    }

    protected <T> @Nullable T getConfig(
            @Nonnull String settingName, @Nullable T defaultValue, @Nonnull Class<T> settingClass) {
        var raw = getEnvValue(settingName);
        return raw == null || raw.isBlank() ? defaultValue : cast(settingName, raw, settingClass);
    }

    /**
     * @throws EvalException of kind CONFIGURATION when the setting is absent
     */
    protected @Nonnull String getRequiredConfig(@Nonnull String settingName) {
        var value = getConfig(settingName, null, String.class);
        if (value == null) {
            throw EvalException.configuration(
                    "%s is required but was not set in the environment".formatted(settingName));
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    protected <T> T cast(
            @Nonnull String settingName, @Nonnull String value, @Nonnull Class<T> clazz) {
        var trimmed = value.trim();
        try {
            Object parsed;
            if (clazz == String.class) {
                parsed = value;
            } else if (clazz == Boolean.class || clazz == boolean.class) {
                parsed = Boolean.valueOf(trimmed);
            } else if (clazz == Integer.class || clazz == int.class) {
                parsed = Integer.valueOf(trimmed);
            } else if (clazz == Long.class || clazz == long.class) {
                parsed = Long.valueOf(trimmed);
            } else if (clazz == Double.class || clazz == double.class) {
                parsed = Double.valueOf(trimmed);
            } else {
                throw new IllegalArgumentException(
                        "no conversion for setting %s of type %s".formatted(settingName, clazz));
            }
            return (T) parsed;
        } catch (NumberFormatException e) {
            throw EvalException.configuration(
                    "%s must be a %s but was '%s'"
                            .formatted(settingName, clazz.getSimpleName(), value));
        }
    }

    /** Override map first, then the process environment. */
    protected @Nullable String getEnvValue(@Nonnull String settingName) {
        var value =
                envOverrides.containsKey(settingName)
                        ? envOverrides.get(settingName)
                        : System.getenv(settingName);
        return NULL_OVERRIDE.equals(value) ? null : value;
    }
}
