package com.hightaste.learner.check;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of checking a set of source files against the rule corpus.
 * Property names follow the engine's JSON report format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckReport(
        @JsonProperty("total_files_checked") int totalFilesChecked,
        @JsonProperty("total_violations") int totalViolations,
        @JsonProperty("violations") List<Violation> violations,
        @JsonProperty("summary_by_rule") Map<String, Integer> summaryByRule
) {

    /**
     * Builds a report from a list of violations, counting them per rule in first-seen order.
     */
    public static CheckReport of(int filesChecked, List<Violation> violations) {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (Violation violation : violations) {
            summary.merge(violation.ruleId(), 1, Integer::sum);
        }
        return new CheckReport(filesChecked, violations.size(), List.copyOf(violations), summary);
    }

    public boolean hasViolations() {
        return totalViolations > 0;
    }
}
