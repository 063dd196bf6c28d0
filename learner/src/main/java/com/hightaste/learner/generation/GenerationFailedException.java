package com.hightaste.learner.generation;

import com.hightaste.learner.RuleLearningException;

/**
 * Thrown when the model is unreachable or its answer cannot be turned into a rule.
 */
public class GenerationFailedException extends RuleLearningException {

    public GenerationFailedException(String message) {
        super(message);
    }

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
