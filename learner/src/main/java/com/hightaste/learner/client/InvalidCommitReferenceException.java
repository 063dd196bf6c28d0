package com.hightaste.learner.client;

import com.hightaste.learner.RuleLearningException;

/**
 * Thrown when a string is not a recognizable GitHub commit URL.
 */
public class InvalidCommitReferenceException extends RuleLearningException {

    private final String url;

    public InvalidCommitReferenceException(String url) {
        super("Invalid GitHub commit URL: " + url);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
