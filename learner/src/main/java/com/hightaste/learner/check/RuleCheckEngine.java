package com.hightaste.learner.check;

import com.hightaste.learner.repository.PersistedRule;

import java.util.List;
import java.util.Set;

/**
 * Applies the learned rule corpus to source files. Implementations live outside
 * this project and are discovered through {@link RuleCheckEngines}.
 */
public interface RuleCheckEngine {

    /** Display name used in logs. */
    String name();

    /** Higher wins when several engines are installed. */
    default int priority() {
        return 0;
    }

    /**
     * Lower-case file extensions, with the dot, that this engine understands.
     * An empty set means every file is passed to the engine.
     */
    default Set<String> fileExtensions() {
        return Set.of();
    }

    CheckReport check(List<SourceFile> files, List<PersistedRule> rules);
}
