package com.hightaste.learner.orchestrator;

import ch.qos.logback.classic.Level;
import com.hightaste.learner.RuleLearningException;
import com.hightaste.learner.check.CheckReport;
import com.hightaste.learner.check.RuleCheckEngine;
import com.hightaste.learner.check.RuleCheckEngines;
import com.hightaste.learner.check.SourceFile;
import com.hightaste.learner.check.Violation;
import com.hightaste.learner.client.GitHubApiClient;
import com.hightaste.learner.config.AppConfig;
import com.hightaste.learner.conversion.ConversionResult;
import com.hightaste.learner.conversion.ConversionSummary;
import com.hightaste.learner.conversion.MarkdownRuleConverter;
import com.hightaste.learner.generation.AnthropicRuleGenerator;
import com.hightaste.learner.model.CategoryPrefixes;
import com.hightaste.learner.repository.PersistedRule;
import com.hightaste.learner.repository.RuleLoader;
import com.hightaste.learner.repository.RuleRepository;
import com.hightaste.learner.yaml.RuleYamlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 * <pre>
 *   java -jar learner.jar [--debug] learn &lt;commit-url&gt;   # learn a rule from a GitHub commit
 *   java -jar learner.jar [--debug] rules                  # list learned rules
 *   java -jar learner.jar [--debug] check &lt;file&gt;...      # check files with an installed engine
 *   java -jar learner.jar [--debug] convert [--first-only]  # convert markdown rules to YAML
 * </pre>
 *
 * <p>Exit codes: 0 on success (including "no pattern found"), 1 on failure or when
 * violations are found, 2 on bad usage.</p>
 */
public class LearnerApp {

    private static final Logger logger = LoggerFactory.getLogger(LearnerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: learner [--debug] learn <commit-url> | rules | check <file>... | convert [--first-only]";

    private final Supplier<AppConfig> configSupplier;
    private final Supplier<Optional<RuleCheckEngine>> engineSupplier;
    private final PrintStream out;
    private final PrintStream err;

    public LearnerApp(PrintStream out, PrintStream err) {
        this(AppConfig::new, RuleCheckEngines::discover, out, err);
    }

    // Visible for testing
    LearnerApp(Supplier<AppConfig> configSupplier, Supplier<Optional<RuleCheckEngine>> engineSupplier,
               PrintStream out, PrintStream err) {
        this.configSupplier = configSupplier;
        this.engineSupplier = engineSupplier;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new LearnerApp(System.out, System.err).run(args));
    }

    public int run(String[] args) {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        boolean debug = arguments.remove("--debug");
        if (debug) {
            enableDebugLogging();
        }

        if (arguments.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String command = arguments.get(0);
        List<String> commandArgs = arguments.subList(1, arguments.size());

        try {
            switch (command) {
                case "learn":
                    if (commandArgs.size() != 1) {
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    return learn(commandArgs.get(0));
                case "rules":
                    return listRules();
                case "check":
                    if (commandArgs.isEmpty()) {
                        err.println("No files provided. Use 'learner check <file>...'");
                        return EXIT_USAGE;
                    }
                    return check(commandArgs);
                case "convert":
                    boolean firstOnly = commandArgs.remove("--first-only");
                    if (!commandArgs.isEmpty()) {
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    return convert(firstOnly);
                default:
                    err.println("Unknown command: " + command);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reportFailure(debug, e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            reportFailure(debug, e);
            return EXIT_FAILURE;
        }
    }

    // -------------------------------------------------------------------------
    // Commands
    // -------------------------------------------------------------------------

    int learn(String commitUrl) throws RuleLearningException, InterruptedException {
        AppConfig config = configSupplier.get();
        config.validate();

        CategoryPrefixes prefixes = CategoryPrefixes.defaults();
        RuleLearningOrchestrator orchestrator = new RuleLearningOrchestrator(
                new GitHubApiClient(config.getGithubApiUrl(), config.getGithubToken()),
                new AnthropicRuleGenerator(config.getAnthropicApiKey(), config.getAnthropicModel(),
                        config.getAnthropicBaseUrl()),
                new RuleRepository(config.getRulesDir(), prefixes, new RuleYamlWriter()),
                prefixes);

        out.println("Analyzing commit: " + commitUrl);
        LearnResult result = orchestrator.learn(commitUrl);

        if (result.ruleCreated()) {
            out.println("New rule created: " + result.path());
            out.println("Rule " + result.rule().id() + " has been saved and can be used for checking code");
        } else {
            out.println("No clear high-taste pattern detected in this commit");
            out.println("Try a commit that shows clear style improvements");
        }
        return EXIT_OK;
    }

    int listRules() throws RuleLearningException {
        AppConfig config = configSupplier.get();
        List<PersistedRule> rules = new RuleLoader(config.getRulesDir()).loadAll();

        out.println("Available rules (" + rules.size() + " total):");
        out.println();
        for (PersistedRule rule : rules) {
            out.println("Rule " + rule.id() + ": " + rule.title());
            out.println("   Category: " + rule.category() + " | File: " + rule.path().getFileName());
            out.println();
        }
        return EXIT_OK;
    }

    int check(List<String> paths) throws RuleLearningException {
        Optional<RuleCheckEngine> engine = engineSupplier.get();
        if (engine.isEmpty()) {
            err.println("No rule-checking engine is installed");
            return EXIT_FAILURE;
        }

        Set<String> extensions = engine.get().fileExtensions();
        List<SourceFile> files = new ArrayList<>();
        for (String path : paths) {
            if (!isSupported(path, extensions)) {
                out.println("Skipping unsupported file: " + path);
                continue;
            }
            try {
                files.add(new SourceFile(path, Files.readString(Path.of(path), StandardCharsets.UTF_8)));
            } catch (IOException e) {
                logger.warn("Could not read {}", path, e);
                err.println("Error reading " + path + ": " + e.getMessage());
            }
        }
        if (files.isEmpty()) {
            out.println("No files to check.");
            return EXIT_OK;
        }

        List<PersistedRule> rules = new RuleLoader(configSupplier.get().getRulesDir()).loadAll();
        CheckReport report = engine.get().check(files, rules);
        printReport(report);
        return report.hasViolations() ? EXIT_FAILURE : EXIT_OK;
    }

    static boolean isSupported(String path, Set<String> extensions) {
        if (extensions.isEmpty()) {
            return true;
        }
        Path fileName = Path.of(path).getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    int convert(boolean firstOnly) throws RuleLearningException {
        AppConfig config = configSupplier.get();
        config.validate();

        MarkdownRuleConverter converter = new MarkdownRuleConverter(
                new AnthropicRuleGenerator(config.getAnthropicApiKey(), config.getAnthropicModel(),
                        config.getAnthropicBaseUrl()),
                new RuleYamlWriter(),
                CategoryPrefixes.defaults());

        ConversionSummary summary = converter.convertAll(config.getRulesDir(), firstOnly);
        for (ConversionResult result : summary.results()) {
            switch (result.status()) {
                case CONVERTED -> out.println("Converted " + result.message() + " to " + result.target());
                case SKIPPED -> out.println("Skipped " + result.source() + ": " + result.message());
                case FAILED -> err.println("Failed to convert " + result.source() + ": " + result.message());
            }
        }

        out.println("Conversion complete:");
        out.println("  Converted: " + summary.convertedCount());
        out.println("  Skipped: " + summary.skippedCount());
        out.println("  Failed: " + summary.failureCount());
        return summary.hasFailures() ? EXIT_FAILURE : EXIT_OK;
    }

    private void printReport(CheckReport report) {
        if (!report.hasViolations()) {
            out.println("No violations found in " + report.totalFilesChecked() + " files");
            return;
        }

        out.println("Found " + report.totalViolations() + " violations in "
                + report.totalFilesChecked() + " files");
        out.println();
        for (Violation violation : report.violations()) {
            out.printf("%s %s:%d:%d%n", violation.isError() ? "[E]" : "[W]",
                    violation.filePath(), violation.lineNumber(), violation.column());
            out.println("   Rule " + violation.ruleId() + ": " + violation.message());
            out.println("   Category: " + violation.category());
            out.println();
        }

        out.println("Summary by rule:");
        for (Map.Entry<String, Integer> entry : report.summaryByRule().entrySet()) {
            out.println("  Rule " + entry.getKey() + ": " + entry.getValue() + " violations");
        }
    }

    // -------------------------------------------------------------------------
    // Error reporting and logging
    // -------------------------------------------------------------------------

    private void reportFailure(boolean debug, Exception e) {
        if (debug) {
            logger.error("Command failed", e);
        } else {
            logger.debug("Command failed", e);
        }
        err.println("Error: " + e.getMessage());
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
