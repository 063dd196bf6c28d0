package com.hightaste.learner.orchestrator;

import com.hightaste.learner.RuleLearningException;
import com.hightaste.learner.client.CommitReference;
import com.hightaste.learner.client.GitHubApiClient;
import com.hightaste.learner.generation.RuleGenerator;
import com.hightaste.learner.generation.RulePrompts;
import com.hightaste.learner.model.CategoryPrefixes;
import com.hightaste.learner.model.CommitRecord;
import com.hightaste.learner.model.Rule;
import com.hightaste.learner.repository.RuleRepository;
import com.hightaste.learner.repository.SavedRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates one learning run: commit URL -> commit data -> prompt -> generated rule
 * -> rule file. The repository is only touched once a valid, non-empty rule is in hand,
 * so a failure at any earlier step leaves no trace on disk.
 */
public class RuleLearningOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RuleLearningOrchestrator.class);

    private final GitHubApiClient client;
    private final RuleGenerator generator;
    private final RuleRepository repository;
    private final CategoryPrefixes prefixes;

    public RuleLearningOrchestrator(GitHubApiClient client, RuleGenerator generator,
                                    RuleRepository repository, CategoryPrefixes prefixes) {
        this.client = client;
        this.generator = generator;
        this.repository = repository;
        this.prefixes = prefixes;
    }

    /**
     * Learns at most one rule from a GitHub commit.
     *
     * @param commitUrl a {@code github.com/<owner>/<repo>/commit/<sha>} URL
     * @return the created rule and its path, or a no-pattern result
     */
    public LearnResult learn(String commitUrl) throws RuleLearningException, InterruptedException {
        CommitReference ref = GitHubApiClient.parseCommitUrl(commitUrl);
        logger.info("Analyzing commit {} in {}", ref.revision(), ref.repoFullName());

        CommitRecord commit = client.fetchCommit(ref);
        String prompt = RulePrompts.buildPrompt(commit, prefixes);
        Rule rule = generator.generate(prompt);

        if (rule.isEmpty()) {
            logger.info("No generalizable pattern found in {}", commitUrl);
            return LearnResult.noPatternFound(commitUrl);
        }

        SavedRule saved = repository.save(rule);
        logger.info("Created rule {} at {}", saved.rule().id(), saved.path());
        return LearnResult.created(commitUrl, saved.rule(), saved.path());
    }
}
