package dev.evalkit.scorer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Names a registered scorer and the options to build it with. */
public record ScorerSpec(String name, Map<String, Object> options) {
    public ScorerSpec {
        Objects.requireNonNull(name, "scorer name");
        options =
                options == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ScorerSpec of(String name) {
        return new ScorerSpec(name, Map.of());
    }

    public static ScorerSpec of(String name, Map<String, Object> options) {
        return new ScorerSpec(name, options);
    }
}
