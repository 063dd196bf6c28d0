package com.hightaste.learner.check;

/**
 * A source file handed to a rule-checking engine.
 */
public record SourceFile(String path, String content) {}
