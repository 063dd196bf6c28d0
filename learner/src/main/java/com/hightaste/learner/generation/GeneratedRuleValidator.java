package com.hightaste.learner.generation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a model-produced JSON object against the rule shape before it is bound
 * to {@link com.hightaste.learner.model.Rule}. Type mismatches are reported instead
 * of being coerced.
 */
public final class GeneratedRuleValidator {

    private GeneratedRuleValidator() {
    }

    /**
     * @return a description of every problem found; empty when the object is a valid rule
     */
    public static List<String> validate(JsonNode node) {
        List<String> problems = new ArrayList<>();
        if (node == null || !node.isObject()) {
            problems.add("rule must be a JSON object");
            return problems;
        }

        requireText(node, "category", "", problems);
        requireText(node, "title", "", problems);

        // A blank title means no rule, so the category is never used as a directory.
        JsonNode title = node.get("title");
        JsonNode category = node.get("category");
        boolean hasTitle = title != null && title.isTextual() && !title.asText().isBlank();
        if (hasTitle && category != null && category.isTextual() && !isDirectoryName(category.asText())) {
            problems.add("category must be a plain name, got '" + category.asText() + "'");
        }
        requireText(node, "description", "", problems);
        requireTextArray(node, "problems", problems);
        requireTextArray(node, "solutions", problems);

        JsonNode id = node.get("id");
        if (id != null && !id.isNull() && !id.isTextual()) {
            problems.add("id must be a string");
        }

        JsonNode examples = node.get("examples");
        if (examples == null || examples.isNull()) {
            problems.add("examples is required");
        } else if (!examples.isArray()) {
            problems.add("examples must be an array");
        } else {
            for (int i = 0; i < examples.size(); i++) {
                JsonNode example = examples.get(i);
                String path = "examples[" + i + "].";
                if (!example.isObject()) {
                    problems.add("examples[" + i + "] must be an object");
                    continue;
                }
                requireText(example, "scenario", path, problems);
                requireText(example, "before", path, problems);
                requireText(example, "after", path, problems);
            }
        }
        return problems;
    }

    private static boolean isDirectoryName(String category) {
        return !category.isBlank() && !category.equals(".") && !category.equals("..")
                && !category.contains("/") && !category.contains("\\");
    }

    private static void requireText(JsonNode node, String field, String path, List<String> problems) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            problems.add(path + field + " is required");
        } else if (!value.isTextual()) {
            problems.add(path + field + " must be a string");
        }
    }

    private static void requireTextArray(JsonNode node, String field, List<String> problems) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            problems.add(field + " is required");
            return;
        }
        if (!value.isArray()) {
            problems.add(field + " must be an array of strings");
            return;
        }
        for (int i = 0; i < value.size(); i++) {
            if (!value.get(i).isTextual()) {
                problems.add(field + "[" + i + "] must be a string");
            }
        }
    }
}
