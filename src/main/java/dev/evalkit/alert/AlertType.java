package dev.evalkit.alert;

public enum AlertType {
    REGRESSION,
    BUDGET_THRESHOLD,
    BUDGET_EXCEEDED,
    RUN_FAILURE
}
