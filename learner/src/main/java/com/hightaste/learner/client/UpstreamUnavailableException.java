package com.hightaste.learner.client;

import com.hightaste.learner.RuleLearningException;

/**
 * Thrown when the GitHub API cannot deliver a commit: a non-success status,
 * a transport failure that survived the retry, or an unusable response body.
 */
public class UpstreamUnavailableException extends RuleLearningException {

    private final int statusCode;

    public UpstreamUnavailableException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
