package com.hightaste.learner.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GeneratedRuleValidator}.
 */
class GeneratedRuleValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("Accepts a complete rule without an id")
    void completeRule_valid() throws Exception {
        List<String> problems = GeneratedRuleValidator.validate(json("""
                {
                  "category": "boundaries",
                  "title": "Validate before dereference",
                  "description": "Check inputs first.",
                  "problems": ["NullPointerException deep in the call stack"],
                  "solutions": ["Guard at the boundary"],
                  "examples": [{"scenario": "Config", "before": "a", "after": "b"}]
                }"""));

        assertTrue(problems.isEmpty(), problems.toString());
    }

    @Test
    @DisplayName("Accepts an empty title")
    void emptyTitle_valid() throws Exception {
        List<String> problems = GeneratedRuleValidator.validate(json("""
                {"category": "style", "title": "", "description": "", "id": "",
                 "problems": [], "solutions": [], "examples": []}"""));

        assertTrue(problems.isEmpty(), problems.toString());
    }

    @Test
    @DisplayName("Reports every missing field")
    void missingFields_reported() throws Exception {
        List<String> problems = GeneratedRuleValidator.validate(json("{\"title\": \"x\"}"));

        assertTrue(problems.contains("category is required"));
        assertTrue(problems.contains("description is required"));
        assertTrue(problems.contains("problems is required"));
        assertTrue(problems.contains("solutions is required"));
        assertTrue(problems.contains("examples is required"));
        assertEquals(5, problems.size());
    }

    @Test
    @DisplayName("Reports wrong types instead of coercing them")
    void wrongTypes_reported() throws Exception {
        List<String> problems = GeneratedRuleValidator.validate(json("""
                {"category": "style", "title": 7, "id": 3, "description": "d",
                 "problems": "not a list", "solutions": ["ok", 5],
                 "examples": [{"scenario": "s", "before": "b"}, "text"]}"""));

        assertTrue(problems.contains("title must be a string"));
        assertTrue(problems.contains("id must be a string"));
        assertTrue(problems.contains("problems must be an array of strings"));
        assertTrue(problems.contains("solutions[1] must be a string"));
        assertTrue(problems.contains("examples[0].after is required"));
        assertTrue(problems.contains("examples[1] must be an object"));
    }

    @Test
    @DisplayName("Rejects categories that are not a plain directory name")
    void pathLikeCategory_rejected() throws Exception {
        List<String> problems = GeneratedRuleValidator.validate(json("""
                {"category": "../etc", "title": "t", "description": "d",
                 "problems": [], "solutions": [], "examples": []}"""));

        assertEquals(1, problems.size());
        assertTrue(problems.get(0).startsWith("category must be a plain name"));
    }

    @Test
    @DisplayName("Accepts any category when the title is blank")
    void blankTitle_blankCategory_valid() throws Exception {
        assertEquals(List.of(), GeneratedRuleValidator.validate(json("""
                {"category": "", "title": "", "description": "",
                 "problems": [], "solutions": [], "examples": []}""")));
        assertEquals(List.of(), GeneratedRuleValidator.validate(json("""
                {"category": "..", "title": "   ", "description": "",
                 "problems": [], "solutions": [], "examples": []}""")));
    }

    @Test
    @DisplayName("Rejects a blank category once a title is present")
    void blankCategory_withTitle_rejected() throws Exception {
        List<String> problems = GeneratedRuleValidator.validate(json("""
                {"category": "", "title": "t", "description": "d",
                 "problems": [], "solutions": [], "examples": []}"""));

        assertEquals(List.of("category must be a plain name, got ''"), problems);
    }

    @Test
    @DisplayName("Rejects a non-object")
    void nonObject_rejected() throws Exception {
        assertEquals(List.of("rule must be a JSON object"), GeneratedRuleValidator.validate(json("[1, 2]")));
        assertEquals(List.of("rule must be a JSON object"), GeneratedRuleValidator.validate(null));
    }
}
