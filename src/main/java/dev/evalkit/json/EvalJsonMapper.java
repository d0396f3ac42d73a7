package dev.evalkit.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.function.Consumer;
import lombok.SneakyThrows;

/** Centralized ObjectMappers for evalkit. JSON and YAML share the same configuration. */
public final class EvalJsonMapper {

    private static volatile ObjectMapper json;
    private static volatile ObjectMapper yaml;

    /** Default configuration applied to all ObjectMapper instances. */
    private static final Consumer<ObjectMapper> DEFAULT_CONFIG =
            objectMapper -> {
                objectMapper
                        .registerModule(new JavaTimeModule())
                        .registerModule(new Jdk8Module())
                        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                        .setDefaultPropertyInclusion(JsonInclude.Include.NON_ABSENT)
                        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            };

    private EvalJsonMapper() {}

    public static ObjectMapper get() {
        if (json == null) {
            synchronized (EvalJsonMapper.class) {
                if (json == null) {
                    var mapper = new ObjectMapper();
                    DEFAULT_CONFIG.accept(mapper);
                    json = mapper;
                }
            }
        }
        return json;
    }

    public static ObjectMapper yaml() {
        if (yaml == null) {
            synchronized (EvalJsonMapper.class) {
                if (yaml == null) {
                    var mapper =
                            new ObjectMapper(
                                    new YAMLFactory()
                                            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                                            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
                    DEFAULT_CONFIG.accept(mapper);
                    yaml = mapper;
                }
            }
        }
        return yaml;
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return get().writeValueAsString(o);
    }

    @SneakyThrows
    public static String toPrettyJson(Object o) {
        return get().writerWithDefaultPrettyPrinter().writeValueAsString(o);
    }

    @SneakyThrows
    public static String toYaml(Object o) {
        return yaml().writeValueAsString(o);
    }

    @SneakyThrows
    public static <T> T fromJson(String jsonString, Class<T> targetClass) {
        return get().readValue(jsonString, targetClass);
    }

    @SneakyThrows
    public static <T> T fromJson(String jsonString, TypeReference<T> targetType) {
        return get().readValue(jsonString, targetType);
    }

    /** Converts an already materialized value (maps, lists, records) into another shape. */
    public static <T> T convert(Object value, Class<T> targetClass) {
        return get().convertValue(value, targetClass);
    }
}
