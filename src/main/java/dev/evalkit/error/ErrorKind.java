package dev.evalkit.error;

/**
 * Closed set of error variants raised by the evaluation engine.
 *
 * <p>Each variant fixes its HTTP-like status and whether the failed operation may be retried. This
 * enum is the only place that mapping lives.
 */
public enum ErrorKind {
    DATASET_INVALID(Category.DATASET, 422, false),
    DATASET_NOT_FOUND(Category.DATASET, 404, false),
    MODEL_TIMEOUT(Category.MODEL_EXECUTION, 504, true),
    MODEL_RATE_LIMITED(Category.MODEL_EXECUTION, 429, true),
    MODEL_UNAVAILABLE(Category.MODEL_EXECUTION, 503, true),
    MODEL_AUTHENTICATION(Category.MODEL_EXECUTION, 401, false),
    MODEL_REJECTED(Category.MODEL_EXECUTION, 400, false),
    SCORING(Category.SCORING, 500, false),
    CONFIGURATION(Category.CONFIGURATION, 400, false),
    DELIVERY(Category.DELIVERY, 502, true),
    NOT_FOUND(Category.STORAGE, 404, false),
    STORAGE_FAILED(Category.STORAGE, 500, false);

    private final Category category;
    private final int httpStatus;
    private final boolean retryable;

    ErrorKind(Category category, int httpStatus, boolean retryable) {
        this.category = category;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public Category category() {
        return category;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }

    /** Whether an error of this kind aborts a run before any test case executes. */
    public boolean fatalForRun() {
        return category == Category.DATASET || category == Category.CONFIGURATION;
    }

    public int exitCode() {
        return category.exitCode;
    }

    /** Coarse grouping used for user-facing messages and exit codes. */
    public enum Category {
        DATASET("dataset", 3),
        MODEL_EXECUTION("model", 4),
        SCORING("scoring", 5),
        CONFIGURATION("config", 6),
        DELIVERY("delivery", 7),
        STORAGE("storage", 8);

        private final String label;
        private final int exitCode;

        Category(String label, int exitCode) {
            this.label = label;
            this.exitCode = exitCode;
        }

        public String label() {
            return label;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
