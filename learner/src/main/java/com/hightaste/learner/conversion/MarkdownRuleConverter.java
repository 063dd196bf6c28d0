package com.hightaste.learner.conversion;

import com.hightaste.learner.generation.RuleGenerator;
import com.hightaste.learner.generation.RulePrompts;
import com.hightaste.learner.model.CategoryPrefixes;
import com.hightaste.learner.model.Rule;
import com.hightaste.learner.repository.PersistenceFailedException;
import com.hightaste.learner.yaml.RuleYamlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Converts hand-written markdown rules into YAML rule files with the model's help.
 * Each {@code <name>.md} under the rules root is written to {@code <name>.yaml}
 * next to it, keeping the id declared in the markdown. Existing YAML files are
 * never overwritten; such files count as failures.
 */
public class MarkdownRuleConverter {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownRuleConverter.class);

    private final RuleGenerator generator;
    private final RuleYamlWriter writer;
    private final CategoryPrefixes prefixes;

    public MarkdownRuleConverter(RuleGenerator generator, RuleYamlWriter writer, CategoryPrefixes prefixes) {
        this.generator = generator;
        this.writer = writer;
        this.prefixes = prefixes;
    }

    /**
     * Converts every markdown file under {@code rulesRoot}, in path order.
     *
     * @param firstOnly stop after the first successful conversion
     */
    public ConversionSummary convertAll(Path rulesRoot, boolean firstOnly) throws PersistenceFailedException {
        List<Path> markdownFiles = findMarkdownFiles(rulesRoot);
        logger.info("Found {} markdown rule files under {}", markdownFiles.size(), rulesRoot);

        List<ConversionResult> results = new ArrayList<>();
        for (Path file : markdownFiles) {
            ConversionResult result = convert(file);
            results.add(result);
            if (firstOnly && result.status() == ConversionResult.Status.CONVERTED) {
                logger.info("Stopping after first conversion");
                break;
            }
        }
        return new ConversionSummary(results);
    }

    List<Path> findMarkdownFiles(Path rulesRoot) throws PersistenceFailedException {
        if (!Files.isDirectory(rulesRoot)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(rulesRoot)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceFailedException("Failed to list markdown rules", rulesRoot, e);
        }
    }

    public ConversionResult convert(Path markdownFile) {
        try {
            String markdown = Files.readString(markdownFile, StandardCharsets.UTF_8);
            MarkdownRule header = MarkdownRule.parse(markdown);
            if (!header.hasId()) {
                logger.warn("Could not extract rule ID from {}", markdownFile);
                return ConversionResult.skipped(markdownFile, "no **ID** line");
            }

            logger.info("Converting rule {} from {}", header.id(), markdownFile);
            Rule rule = generator.generate(RulePrompts.buildConversionPrompt(markdown, prefixes));
            if (rule.isEmpty()) {
                return ConversionResult.skipped(markdownFile, "model returned no rule");
            }

            Path target = yamlPathFor(markdownFile);
            writer.writeRule(rule.withId(header.id()), target);
            return ConversionResult.converted(markdownFile, target, header.id());
        } catch (Exception e) {
            logger.error("Failed to convert {}", markdownFile, e);
            return ConversionResult.failure(markdownFile, e.getMessage());
        }
    }

    static Path yamlPathFor(Path markdownFile) {
        String name = markdownFile.getFileName().toString();
        return markdownFile.resolveSibling(name.substring(0, name.length() - ".md".length()) + ".yaml");
    }
}
