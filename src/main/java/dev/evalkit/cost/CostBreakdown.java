package dev.evalkit.cost;

/**
 * Spend for one group of entries.
 *
 * @param key group key, e.g. a model id or {@code model:dataset}
 * @param runs number of distinct runs contributing
 * @param percentage share of total spend, 0..100
 */
public record CostBreakdown(String key, double costUsd, long tokens, int runs, double percentage) {}
