package com.hightaste.learner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One before/after illustration of a rule. {@code before} and {@code after}
 * usually hold fenced code blocks and are kept as literal text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleExample(
        @JsonProperty("scenario") String scenario,
        @JsonProperty("before") String before,
        @JsonProperty("after") String after
) {}
