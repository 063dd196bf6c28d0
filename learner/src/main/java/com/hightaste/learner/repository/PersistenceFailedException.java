package com.hightaste.learner.repository;

import com.hightaste.learner.RuleLearningException;

import java.nio.file.Path;

/**
 * Thrown when the rules directory cannot be read or written.
 */
public class PersistenceFailedException extends RuleLearningException {

    private final Path path;

    public PersistenceFailedException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
