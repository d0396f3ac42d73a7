package dev.evalkit.error;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ErrorKindTest {
    @Test
    void onlyTransientModelAndDeliveryFailuresAreRetryable() {
        var retryable =
                Arrays.stream(ErrorKind.values())
                        .filter(ErrorKind::retryable)
                        .collect(Collectors.toSet());
        assertEquals(
                Set.of(
                        ErrorKind.MODEL_TIMEOUT,
                        ErrorKind.MODEL_RATE_LIMITED,
                        ErrorKind.MODEL_UNAVAILABLE,
                        ErrorKind.DELIVERY),
                retryable);
    }

    @Test
    void statusCodes() {
        assertEquals(422, ErrorKind.DATASET_INVALID.httpStatus());
        assertEquals(404, ErrorKind.DATASET_NOT_FOUND.httpStatus());
        assertEquals(429, ErrorKind.MODEL_RATE_LIMITED.httpStatus());
        assertEquals(504, ErrorKind.MODEL_TIMEOUT.httpStatus());
        assertEquals(401, ErrorKind.MODEL_AUTHENTICATION.httpStatus());
    }

    @Test
    void datasetAndConfigurationErrorsAreFatalForARun() {
        assertTrue(ErrorKind.DATASET_NOT_FOUND.fatalForRun());
        assertTrue(ErrorKind.CONFIGURATION.fatalForRun());
        assertFalse(ErrorKind.MODEL_TIMEOUT.fatalForRun());
        assertFalse(ErrorKind.SCORING.fatalForRun());
    }

    @Test
    void everyCategoryHasADistinctExitCode() {
        var codes =
                Arrays.stream(ErrorKind.Category.values())
                        .map(ErrorKind.Category::exitCode)
                        .collect(Collectors.toSet());
        assertEquals(ErrorKind.Category.values().length, codes.size());
        assertFalse(codes.contains(0));
        assertFalse(codes.contains(1));
        assertFalse(codes.contains(2));
    }

    @Test
    void describeUsesTheCategoryLabel() {
        var error = EvalException.datasetNotFound("qa", "2.0.0");
        assertEquals("error[dataset]: dataset not found: qa@2.0.0", error.describe());
        assertEquals(Map.of("datasetId", "qa", "version", "2.0.0"), error.context());
        assertEquals(3, error.kind().exitCode());
    }

    @Test
    void validationProblemsTravelInTheContext() {
        var error = EvalException.datasetInvalid("qa", List.of("duplicate id: a", "empty name"));
        assertEquals(ErrorKind.DATASET_INVALID, error.kind());
        assertEquals(List.of("duplicate id: a", "empty name"), error.context().get("errors"));
        assertTrue(error.getMessage().contains("2 error(s)"));
        assertFalse(error.retryable());
    }

    @Test
    void rateLimitCarriesRetryAfter() {
        var error = EvalException.rateLimited("gpt-4o", Duration.ofSeconds(3), null);
        assertTrue(error.retryable());
        assertEquals(Duration.ofSeconds(3), error.retryAfter().orElseThrow());
        assertTrue(EvalException.timeout("gpt-4o", Duration.ofSeconds(1)).retryAfter().isEmpty());
    }
}
