package com.hightaste.learner.conversion;

import java.nio.file.Path;

/**
 * Outcome of converting one markdown rule file.
 */
public record ConversionResult(
        Path source,
        Path target,
        Status status,
        String message
) {

    public enum Status { CONVERTED, SKIPPED, FAILED }

    public static ConversionResult converted(Path source, Path target, String ruleId) {
        return new ConversionResult(source, target, Status.CONVERTED, ruleId);
    }

    public static ConversionResult skipped(Path source, String reason) {
        return new ConversionResult(source, null, Status.SKIPPED, reason);
    }

    public static ConversionResult failure(Path source, String error) {
        return new ConversionResult(source, null, Status.FAILED, error);
    }
}
