package com.hightaste.learner.model;

/**
 * A fetched commit: its message, the unified diff as plain text,
 * and the browser URL it was fetched for.
 */
public record CommitRecord(
        String message,
        String diffText,
        String sourceUrl
) {}
