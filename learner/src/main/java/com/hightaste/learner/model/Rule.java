package com.hightaste.learner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A coding-style rule as produced by the model.
 *
 * <p>The {@code id} coming from the model is provisional and may be {@code null};
 * the rule repository replaces it through {@link #withId(String)} before the rule
 * is written. Once written, a rule is never updated in place.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Rule(
        @JsonProperty("category") String category,
        @JsonProperty("title") String title,
        @JsonProperty("id") String id,
        @JsonProperty("description") String description,
        @JsonProperty("problems") List<String> problems,
        @JsonProperty("solutions") List<String> solutions,
        @JsonProperty("examples") List<RuleExample> examples
) {

    public Rule {
        problems = problems == null ? List.of() : List.copyOf(problems);
        solutions = solutions == null ? List.of() : List.copyOf(solutions);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public Rule withId(String assignedId) {
        return new Rule(category, title, assignedId, description, problems, solutions, examples);
    }

    /**
     * An empty or whitespace-only title is how the model says it found
     * nothing worth generalizing in the commit.
     */
    public boolean isEmpty() {
        return title == null || title.isBlank();
    }
}
