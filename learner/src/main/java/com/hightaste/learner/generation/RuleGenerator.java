package com.hightaste.learner.generation;

import com.hightaste.learner.model.Rule;

/**
 * Turns an analysis prompt into a structured rule.
 *
 * <p>A returned rule with a blank title is a valid answer meaning that no
 * generalizable pattern was found; it is not a failure.</p>
 */
public interface RuleGenerator {

    Rule generate(String prompt) throws GenerationFailedException;
}
