package dev.evalkit.config;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class EvalKitConfigTest {
    @Test
    void overridesAreRead() {
        var config =
                EvalKitConfig.of(
                        "EVALKIT_DASHBOARD_URL", "https://evals.example.com",
                        "EVALKIT_REQUEST_TIMEOUT", "15",
                        "EVALKIT_DATASETS_DIR", "/tmp/data",
                        "EVALKIT_ALERT_EMAIL_TO", "a@example.com, b@example.com");
        assertEquals("https://evals.example.com", config.dashboardUrl().orElseThrow());
        assertEquals(Duration.ofSeconds(15), config.requestTimeout());
        assertEquals("/tmp/data", config.datasetsDir());
        assertEquals(List.of("a@example.com", "b@example.com"), config.emailTo());
    }

    @Test
    void emailAlertsNeedAKeyAndRecipients() {
        var noKey =
                EvalKitConfig.builder()
                        .emailApiKey(null)
                        .emailTo("ops@example.com")
                        .build();
        assertFalse(noKey.emailAlertsEnabled());

        var enabled =
                EvalKitConfig.builder().emailApiKey("key").emailTo("ops@example.com").build();
        assertTrue(enabled.emailAlertsEnabled());
    }

    @Test
    void missingApiKeyIsAConfigurationError() {
        var config = EvalKitConfig.builder().openAiApiKey(null).build();
        assertFalse(config.hasOpenAiApiKey());
        var error = assertThrows(EvalException.class, config::openAiApiKey);
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
    }

    @Test
    void malformedNumbersAreConfigurationErrors() {
        var error =
                assertThrows(
                        EvalException.class,
                        () -> EvalKitConfig.of("EVALKIT_REQUEST_TIMEOUT", "soon"));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
    }

    @Test
    void oddOverridesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EvalKitConfig.of("EVALKIT_DEBUG"));
    }

    @Test
    void builderHasMethodForEveryField() {
        Set<String> builderMethodNames =
                Arrays.stream(EvalKitConfig.Builder.class.getDeclaredMethods())
                        .map(Method::getName)
                        .collect(Collectors.toSet());
        for (Field field : EvalKitConfig.class.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            assertTrue(
                    builderMethodNames.contains(field.getName()),
                    "Builder is missing method for field: " + field.getName());
        }
    }
}
