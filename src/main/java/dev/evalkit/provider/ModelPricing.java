package dev.evalkit.provider;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/** Per-1K-token prices in USD for known models. */
@Slf4j
public final class ModelPricing {
    public record Price(double inputPer1k, double outputPer1k) {}

    private static final Map<String, Price> PRICES;

    static {
        var prices = new LinkedHashMap<String, Price>();
        prices.put("gpt-4", new Price(0.03, 0.06));
        prices.put("gpt-4-turbo", new Price(0.01, 0.03));
        prices.put("gpt-4o", new Price(0.0025, 0.01));
        prices.put("gpt-4o-mini", new Price(0.00015, 0.0006));
        prices.put("gpt-3.5-turbo", new Price(0.0005, 0.0015));
        prices.put("claude-opus-4", new Price(0.015, 0.075));
        prices.put("claude-sonnet-4", new Price(0.003, 0.015));
        prices.put("claude-haiku-4", new Price(0.00025, 0.00125));
        PRICES = Map.copyOf(prices);
    }

    private static final Set<String> warnedModels = ConcurrentHashMap.newKeySet();

    private ModelPricing() {}

    /**
     * Looks a model up by exact name, then by the longest known prefix so that dated snapshots
     * such as {@code gpt-4o-mini-2024-07-18} resolve to their family.
     */
    public static Optional<Price> lookup(String model) {
        if (model == null) {
            return Optional.empty();
        }
        var exact = PRICES.get(model);
        if (exact != null) {
            return Optional.of(exact);
        }
        return PRICES.keySet().stream()
                .filter(model::startsWith)
                .max(Comparator.comparingInt(String::length))
                .map(PRICES::get);
    }

    public static double costUsd(String model, long promptTokens, long completionTokens) {
        var price = lookup(model);
        if (price.isEmpty()) {
            if (warnedModels.add(String.valueOf(model))) {
                log.warn("no pricing known for model '{}', cost will be reported as 0", model);
            }
            return 0.0;
        }
        return (promptTokens / 1000.0) * price.get().inputPer1k()
                + (completionTokens / 1000.0) * price.get().outputPer1k();
    }
}
