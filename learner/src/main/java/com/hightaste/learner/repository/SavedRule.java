package com.hightaste.learner.repository;

import com.hightaste.learner.model.Rule;

import java.nio.file.Path;

/**
 * A rule as written: carrying its assigned id, and the file it was written to.
 */
public record SavedRule(Rule rule, Path path) {}
