package dev.evalkit.baseline;

/** A tracked metric that got worse compared with the active baseline. */
public record Regression(
        String metric, double baselineValue, double currentValue, double delta, Severity severity) {

    /** Relative change in percent, 0 when the baseline value is 0. */
    public double percentChange() {
        return baselineValue == 0 ? 0.0 : delta / Math.abs(baselineValue) * 100;
    }
}
