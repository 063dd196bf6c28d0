package com.hightaste.learner.check;

import com.hightaste.learner.repository.PersistedRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Test engine: flags every line containing {@code System.out} against the first loaded rule.
 */
public class StubRuleCheckEngine implements RuleCheckEngine {

    @Override
    public String name() {
        return "stub";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of(".java");
    }

    @Override
    public CheckReport check(List<SourceFile> files, List<PersistedRule> rules) {
        String ruleId = rules.isEmpty() ? "NONE" : rules.get(0).id();
        String category = rules.isEmpty() ? "none" : rules.get(0).category();
        List<Violation> violations = new ArrayList<>();
        for (SourceFile file : files) {
            String[] lines = file.content().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                int column = lines[i].indexOf("System.out");
                if (column >= 0) {
                    violations.add(new Violation(file.path(), i + 1, column + 1, ruleId,
                            "Use a logger instead of System.out", "Warning", category));
                }
            }
        }
        return CheckReport.of(files.size(), violations);
    }
}
