package com.hightaste.learner;

/**
 * Base type for every failure that aborts a learning run: a bad commit URL,
 * an unavailable upstream, a failed generation or a failed write.
 */
public class RuleLearningException extends Exception {

    public RuleLearningException(String message) {
        super(message);
    }

    public RuleLearningException(String message, Throwable cause) {
        super(message, cause);
    }
}
