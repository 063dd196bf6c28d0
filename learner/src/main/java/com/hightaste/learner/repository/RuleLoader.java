package com.hightaste.learner.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.hightaste.learner.model.RuleExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads the rule corpus back from the rules root: every {@code <category>/*.yaml} file.
 */
public class RuleLoader {

    private static final Logger logger = LoggerFactory.getLogger(RuleLoader.class);

    private final Path rulesRoot;
    private final YAMLMapper yamlMapper;

    public RuleLoader(Path rulesRoot) {
        this.rulesRoot = rulesRoot;
        this.yamlMapper = YAMLMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * @return all persisted rules sorted by id, or an empty list when the root does not exist
     */
    public List<PersistedRule> loadAll() throws PersistenceFailedException {
        if (!Files.isDirectory(rulesRoot)) {
            logger.debug("Rules root {} does not exist", rulesRoot);
            return List.of();
        }

        List<PersistedRule> rules = new ArrayList<>();
        try (DirectoryStream<Path> categories = Files.newDirectoryStream(rulesRoot, Files::isDirectory)) {
            for (Path categoryDirectory : categories) {
                try (DirectoryStream<Path> files =
                             Files.newDirectoryStream(categoryDirectory, RuleRepository.RULE_FILE_GLOB)) {
                    for (Path file : files) {
                        rules.add(load(categoryDirectory.getFileName().toString(), file));
                    }
                }
            }
        } catch (IOException e) {
            throw new PersistenceFailedException("Failed to list rules", rulesRoot, e);
        }

        rules.sort(Comparator.comparing(PersistedRule::id, Comparator.nullsLast(Comparator.naturalOrder())));
        logger.info("Loaded {} rules from {}", rules.size(), rulesRoot);
        return rules;
    }

    PersistedRule load(String category, Path file) throws PersistenceFailedException {
        RuleDocument document;
        try {
            document = yamlMapper.readValue(file.toFile(), RuleDocument.class);
        } catch (IOException e) {
            throw new PersistenceFailedException("Failed to read rule", file, e);
        }
        return new PersistedRule(category, file, document.title(), document.id(), document.description(),
                orEmpty(document.problems()), orEmpty(document.solutions()), orEmpty(document.examples()));
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleDocument(
            @JsonProperty("title") String title,
            @JsonProperty("id") String id,
            @JsonProperty("description") String description,
            @JsonProperty("problems") List<String> problems,
            @JsonProperty("solutions") List<String> solutions,
            @JsonProperty("examples") List<RuleExample> examples
    ) {}
}
