package com.hightaste.learner.generation;

import com.hightaste.learner.model.CategoryPrefixes;
import com.hightaste.learner.model.CommitRecord;

/**
 * Prompt text sent to the model. {@link #buildPrompt} only substitutes values;
 * the commit message, URL and diff are embedded verbatim.
 */
public final class RulePrompts {

    public static final String SYSTEM_PROMPT = """
            You are an expert software engineer and technical writer specializing in code quality \
            and best practices. You have deep experience with open source projects and understand \
            real-world development challenges. Your writing is clear, practical, and actionable.""";

    public static final String RULE_DETAILS_PROMPT = """
            <RuleDefinition>
            A rule describes one coding best practice. It has:
            1. A short imperative title
            2. A description explaining what the rule is about and when it applies
            3. Specific problems caused by the bad practice
            4. Specific solutions and practices that fix it
            5. Before/after examples, each with a short scenario label

            For the problems and solutions:
            - Be specific and actionable
            - Include consequences of not following the rule
            - Provide concrete steps to apply the solution

            Each example should:
            - Show realistic before/after code taken from or modelled on the diff
            - Put each code sample in a fenced code block
            - Demonstrate the violation and its fix

            Example of the expected structure:

            title: Use comments to explain *why*, not *what*
            description: |-
              Comments should explain the reasoning and intent behind code decisions
              rather than describing what the code literally does.
            problems:
              - They duplicate information already visible in the code
              - They become outdated when the code changes
            solutions:
              - Explain business rules, edge cases and design decisions
              - Delete comments that restate the code
            examples:
              - scenario: Loop over orders
                before: |-
                  ```
                  // loop over the orders
                  for (Order order : orders) { ... }
                  ```
                after: |-
                  ```
                  // cancelled orders were already refunded upstream
                  for (Order order : activeOrders) { ... }
                  ```
            </RuleDefinition>""";

    private static final String INSTRUCTIONS = """
            Given a git diff showing before/after changes, identify if there's a clear style \
            improvement pattern that could be generalized into a coding rule.

            Focus on:
            - Code organization and structure improvements
            - Naming convention upgrades
            - Function/class design enhancements
            - Error handling improvements
            - Performance optimizations
            - Readability enhancements

            Generate a rule ONLY if there's a clear, generalizable pattern that represents good \
            taste rather than just a bug fix. If there is none, return the rule with an empty title.""";

    private static final String CONVERSION_INSTRUCTIONS = """
            Convert the markdown rule below into the rule structure. Keep its title and intent. \
            Write a description of what the rule is about, the problems the bad practice causes, \
            the solutions that fix it, and realistic before/after examples covering different \
            kinds of projects (web services, data processing, CLIs, tests).""";

    private RulePrompts() {
    }

    public static String buildConversionPrompt(String markdown, CategoryPrefixes prefixes) {
        return RULE_DETAILS_PROMPT + "\n\n"
                + CONVERSION_INSTRUCTIONS + "\n\n"
                + "For the category, choose from: " + String.join(", ", prefixes.categories()) + "\n\n"
                + "MARKDOWN RULE:\n" + markdown + "\n";
    }

    public static String buildPrompt(CommitRecord commit, CategoryPrefixes prefixes) {
        return RULE_DETAILS_PROMPT + "\n\n"
                + INSTRUCTIONS + "\n\n"
                + "For the category, choose from: " + String.join(", ", prefixes.categories()) + "\n\n"
                + "COMMIT MESSAGE:\n" + commit.message() + "\n\n"
                + "COMMIT URL:\n" + commit.sourceUrl() + "\n\n"
                + "DIFF:\n" + commit.diffText() + "\n";
    }
}
