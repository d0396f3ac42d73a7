package dev.evalkit.baseline;

/** How bad a regression is. Declared from least to most severe. */
public enum Severity {
    MINOR,
    MAJOR,
    CRITICAL;

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
