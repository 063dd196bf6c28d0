package com.hightaste.learner.check;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One rule violation reported by a rule-checking engine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Violation(
        @JsonProperty("file_path") String filePath,
        @JsonProperty("line_number") int lineNumber,
        @JsonProperty("column") int column,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("message") String message,
        @JsonProperty("severity") String severity,
        @JsonProperty("category") String category
) {

    public boolean isError() {
        return "Error".equalsIgnoreCase(severity);
    }
}
