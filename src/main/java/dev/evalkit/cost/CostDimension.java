package dev.evalkit.cost;

/** Keys spend can be grouped by. */
public enum CostDimension {
    MODEL,
    DATASET,
    RUN,
    /** Calendar day, UTC. */
    TIME
}
