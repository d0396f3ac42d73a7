package dev.evalkit.baseline;

/** A tracked metric that got better compared with the active baseline. */
public record Improvement(String metric, double baselineValue, double currentValue, double delta) {}
