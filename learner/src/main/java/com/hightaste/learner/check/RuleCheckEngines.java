package com.hightaste.learner.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Discovers installed {@link RuleCheckEngine} implementations through {@link ServiceLoader}.
 */
public final class RuleCheckEngines {

    private static final Logger logger = LoggerFactory.getLogger(RuleCheckEngines.class);

    private RuleCheckEngines() {
    }

    /**
     * @return the highest-priority installed engine, or empty when none is on the classpath
     */
    public static Optional<RuleCheckEngine> discover() {
        ServiceLoader<RuleCheckEngine> loader = ServiceLoader.load(RuleCheckEngine.class);

        Optional<RuleCheckEngine> engine = StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(RuleCheckEngine::priority));

        engine.ifPresentOrElse(
                e -> logger.info("Using rule-checking engine: {} (priority: {})", e.name(), e.priority()),
                () -> logger.warn("No rule-checking engine found on the classpath"));
        return engine;
    }
}
