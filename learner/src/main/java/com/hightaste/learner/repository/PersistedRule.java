package com.hightaste.learner.repository;

import com.hightaste.learner.model.RuleExample;

import java.nio.file.Path;
import java.util.List;

/**
 * A rule read back from the rules directory, together with the category
 * directory and the file it was found in.
 */
public record PersistedRule(
        String category,
        Path path,
        String title,
        String id,
        String description,
        List<String> problems,
        List<String> solutions,
        List<RuleExample> examples
) {}
