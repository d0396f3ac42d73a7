package dev.evalkit.dataset;

/** What {@link DatasetStore#list()} reports per dataset version. */
public record DatasetSummary(
        String id, String name, String version, String description, int testCaseCount) {}
