package com.hightaste.learner.repository;

import com.hightaste.learner.model.CategoryPrefixes;
import com.hightaste.learner.model.Rule;
import com.hightaste.learner.yaml.RuleYamlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File-system store for learned rules. Each category owns a directory under the
 * rules root; files are named {@code <NNN>-<id>.yaml} where {@code NNN} is the
 * rule's sequence number inside its category.
 *
 * <p>Numbers are assigned by scanning the category directory and taking one more
 * than the highest number found, so deleted rules leave gaps that are never reused.
 * The scan and the write are not atomic: at most one process may write to a given
 * category directory at a time. A collision caused by a second writer surfaces as a
 * {@link PersistenceFailedException}, since rule files are never overwritten.</p>
 */
public class RuleRepository {

    private static final Logger logger = LoggerFactory.getLogger(RuleRepository.class);

    static final Pattern NUMBERED_FILE = Pattern.compile("^(\\d+)-");
    static final String RULE_FILE_GLOB = "*.yaml";

    private final Path rulesRoot;
    private final CategoryPrefixes prefixes;
    private final RuleYamlWriter writer;

    public RuleRepository(Path rulesRoot, CategoryPrefixes prefixes, RuleYamlWriter writer) {
        this.rulesRoot = rulesRoot;
        this.prefixes = prefixes;
        this.writer = writer;
    }

    /**
     * Assigns the rule its final id and writes it to its category directory.
     *
     * @return the identified rule and the path of its new file
     */
    public SavedRule save(Rule rule) throws PersistenceFailedException {
        Path categoryDirectory = resolveCategoryDirectory(rule.category());
        int number = nextNumber(categoryDirectory);
        Rule identified = assignIdentity(rule, number);
        Path path = materializePath(identified, number);
        logger.info("Saving rule {} in category '{}'", identified.id(), rule.category());
        return new SavedRule(identified, writer.writeRule(identified, path));
    }

    /**
     * Categories outside the prefix table are stored under their literal name,
     * which must be a single path segment.
     */
    public Path resolveCategoryDirectory(String category) {
        if (category == null || category.isBlank() || category.equals(".") || category.equals("..")
                || category.contains("/") || category.contains("\\")) {
            throw new IllegalArgumentException("Invalid rule category: '" + category + "'");
        }
        return rulesRoot.resolve(category);
    }

    /**
     * Returns one more than the highest leading number among the category's rule files,
     * or 1 when the directory is missing or holds no numbered files.
     */
    public int nextNumber(Path categoryDirectory) throws PersistenceFailedException {
        if (!Files.isDirectory(categoryDirectory)) {
            return 1;
        }

        int max = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(categoryDirectory, RULE_FILE_GLOB)) {
            for (Path file : files) {
                Matcher matcher = NUMBERED_FILE.matcher(file.getFileName().toString());
                if (!matcher.find()) {
                    continue;
                }
                try {
                    max = Math.max(max, Integer.parseInt(matcher.group(1)));
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring rule file with out-of-range number: {}", file);
                }
            }
        } catch (IOException e) {
            throw new PersistenceFailedException("Failed to list rules", categoryDirectory, e);
        }

        logger.debug("Highest rule number in {} is {}", categoryDirectory, max);
        return max + 1;
    }

    public Rule assignIdentity(Rule rule, int number) {
        return rule.withId(formatId(prefixes.prefixFor(rule.category()), number));
    }

    /**
     * Returns the file path for an identified rule, creating its category directory.
     */
    public Path materializePath(Rule rule, int number) throws PersistenceFailedException {
        Path categoryDirectory = resolveCategoryDirectory(rule.category());
        try {
            Files.createDirectories(categoryDirectory);
        } catch (IOException e) {
            throw new PersistenceFailedException("Failed to create rules directory", categoryDirectory, e);
        }
        return categoryDirectory.resolve(formatNumber(number) + "-" + rule.id().toLowerCase(Locale.ROOT) + ".yaml");
    }

    static String formatId(String prefix, int number) {
        return prefix + formatNumber(number);
    }

    static String formatNumber(int number) {
        return String.format(Locale.ROOT, "%03d", number);
    }
}
