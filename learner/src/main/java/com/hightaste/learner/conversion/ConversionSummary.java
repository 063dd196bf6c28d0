package com.hightaste.learner.conversion;

import java.util.List;

/**
 * Aggregated outcome of a conversion run.
 */
public record ConversionSummary(List<ConversionResult> results) {

    public ConversionSummary {
        results = List.copyOf(results);
    }

    public int convertedCount() {
        return count(ConversionResult.Status.CONVERTED);
    }

    public int skippedCount() {
        return count(ConversionResult.Status.SKIPPED);
    }

    public int failureCount() {
        return count(ConversionResult.Status.FAILED);
    }

    public boolean hasFailures() {
        return failureCount() > 0;
    }

    private int count(ConversionResult.Status status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }
}
