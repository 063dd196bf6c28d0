package com.hightaste.learner.yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.hightaste.learner.model.Rule;
import com.hightaste.learner.model.RuleExample;
import com.hightaste.learner.repository.PersistenceFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders rules as YAML artifacts.
 *
 * <p>Output rules:</p>
 * <ul>
 *   <li>keys keep the order they were given in, they are never sorted;</li>
 *   <li>every string containing a line break is written as a literal {@code |} block,
 *       every other string as an inline scalar, decided per string;</li>
 *   <li>strings that would read back as another type are quoted;</li>
 *   <li>non-ASCII characters are written as-is.</li>
 * </ul>
 */
public class RuleYamlWriter {

    private static final Logger logger = LoggerFactory.getLogger(RuleYamlWriter.class);

    private final YAMLMapper yamlMapper;

    public RuleYamlWriter() {
        YAMLFactory factory = YAMLFactory.builder()
                .stringQuotingChecker(new PlainScalarQuotingChecker())
                .build();
        this.yamlMapper = YAMLMapper.builder(factory)
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    /**
     * Serializes an ordered mapping to YAML text.
     */
    public String serialize(Map<String, ?> document) {
        try {
            return yamlMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document cannot be rendered as YAML", e);
        }
    }

    /**
     * Builds the persisted form of a rule. The category is not part of the
     * document: it is carried by the directory the file lives in.
     */
    public Map<String, Object> toDocument(Rule rule) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("title", rule.title());
        document.put("id", rule.id());
        document.put("description", rule.description());
        document.put("problems", rule.problems());
        document.put("solutions", rule.solutions());

        List<Map<String, Object>> examples = new ArrayList<>();
        for (RuleExample example : rule.examples()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("scenario", example.scenario());
            entry.put("before", example.before());
            entry.put("after", example.after());
            examples.add(entry);
        }
        document.put("examples", examples);
        return document;
    }

    /**
     * Writes a rule to {@code path}. The YAML text is fully rendered before the file
     * is opened, and an existing file is never overwritten.
     */
    public Path writeRule(Rule rule, Path path) throws PersistenceFailedException {
        String yaml = serialize(toDocument(rule));
        try {
            Files.writeString(path, yaml, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PersistenceFailedException("Failed to write rule " + rule.id(), path, e);
        }
        logger.info("Wrote rule {} to {}", rule.id(), path);
        return path;
    }
}
