package com.hightaste.learner.orchestrator;

import com.hightaste.learner.model.Rule;

import java.nio.file.Path;

/**
 * Outcome of learning from one commit: either a rule was written to {@code path},
 * or the model found no generalizable pattern and nothing was written.
 */
public record LearnResult(
        String commitUrl,
        Rule rule,
        Path path
) {

    public static LearnResult created(String commitUrl, Rule rule, Path path) {
        return new LearnResult(commitUrl, rule, path);
    }

    public static LearnResult noPatternFound(String commitUrl) {
        return new LearnResult(commitUrl, null, null);
    }

    public boolean ruleCreated() {
        return path != null;
    }
}
