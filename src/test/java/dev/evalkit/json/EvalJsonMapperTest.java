package dev.evalkit.json;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EvalJsonMapperTest {

    @Test
    void toJson_usesSnakeCase() {
        record Entry(String runId, double costUsd) {}

        assertEquals(
                "{\"run_id\":\"r1\",\"cost_usd\":0.5}",
                EvalJsonMapper.toJson(new Entry("r1", 0.5)));
    }

    @Test
    void toJson_writesInstantsAsIsoStrings() {
        record Stamped(Instant at) {}

        var json = EvalJsonMapper.toJson(new Stamped(Instant.parse("2025-03-10T12:00:00Z")));

        assertEquals("{\"at\":\"2025-03-10T12:00:00Z\"}", json);
    }

    @Test
    void toJson_leavesOutAbsentValues() {
        record Alertish(String title, Optional<String> runId, String message) {}

        var json = EvalJsonMapper.toJson(new Alertish("t", Optional.empty(), null));

        assertEquals("{\"title\":\"t\"}", json);
    }

    @Test
    void fromJson_ignoresUnknownProperties() {
        record Named(String name) {}

        var named = EvalJsonMapper.fromJson("{\"name\":\"qa\",\"extra\":true}", Named.class);

        assertEquals("qa", named.name());
    }

    @Test
    void yamlSharesConfiguration() throws Exception {
        record Budget(String period, double limitUsd) {}

        var yaml = EvalJsonMapper.toYaml(new Budget("daily", 10.0));

        assertEquals("period: daily\nlimit_usd: 10.0\n", yaml);
        var back =
                EvalJsonMapper.yaml()
                        .readValue(yaml, new TypeReference<Map<String, Object>>() {});
        assertEquals(List.of("period", "limit_usd"), List.copyOf(back.keySet()));
    }
}
