package com.hightaste.learner.orchestrator;

import com.hightaste.learner.check.StubRuleCheckEngine;
import com.hightaste.learner.config.AppConfig;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command-level tests for {@link LearnerApp}. GitHub and the model are served by one
 * {@link MockWebServer}; rules are written to a temporary directory.
 */
class LearnerAppTest {

    private static final String COMMIT_URL = "https://github.com/octo/widgets/commit/abc123";

    private static final String TOOL_RESPONSE = """
            {"stop_reason": "tool_use", "content": [{"type": "tool_use", "name": "record_rule", "input": {
              "category": "boundaries",
              "title": "Validate before dereference",
              "description": "Check values at the boundary.",
              "problems": ["Late failures"],
              "solutions": ["Guard early"],
              "examples": [{"scenario": "Config", "before": "```\\nuse(c.t)\\n```", "after": "```\\nif (c != null) use(c.t)\\n```"}]
            }}]}""";

    private static final String EMPTY_RESPONSE = """
            {"stop_reason": "tool_use", "content": [{"type": "tool_use", "name": "record_rule", "input": {
              "category": "style", "title": "", "description": "", "problems": [], "solutions": [], "examples": []
            }}]}""";

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private String modelResponse;

    @BeforeEach
    void setUp() throws IOException {
        modelResponse = TOOL_RESPONSE;
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                if (path.equals("/v1/messages")) {
                    return new MockResponse().setResponseCode(200).setBody(modelResponse);
                }
                if (path.equals("/repos/octo/widgets/commits/abc123")) {
                    if ("application/vnd.github.diff".equals(request.getHeader("Accept"))) {
                        return new MockResponse().setResponseCode(200)
                                .setBody("-use(c.t)\n+if (c != null) use(c.t)\n");
                    }
                    return new MockResponse().setResponseCode(200)
                            .setBody("{\"commit\": {\"message\": \"Guard config access\"}}");
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        server.start();

        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private Path rulesDir() {
        return tempDir.resolve("rules");
    }

    private LearnerApp app(String apiKey) {
        String baseUrl = server.url("/").toString();
        AppConfig config = new AppConfig(apiKey, null, rulesDir(), baseUrl, baseUrl);
        return new LearnerApp(() -> config, () -> Optional.of(new StubRuleCheckEngine()),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // =========================================================================
    // learn
    // =========================================================================

    @Test
    @DisplayName("learn writes a rule and reports its path")
    void learn_createsRule() {
        int exitCode = app("sk-test").run(new String[]{"learn", COMMIT_URL});

        Path expected = rulesDir().resolve("boundaries").resolve("001-bnd001.yaml");
        assertEquals(LearnerApp.EXIT_OK, exitCode, stderr());
        assertTrue(stdout().contains("New rule created: " + expected));
        assertTrue(Files.exists(expected));
        assertEquals(3, server.getRequestCount());
    }

    @Test
    @DisplayName("learn reports 'no pattern' as a success")
    void learn_noPattern() {
        modelResponse = EMPTY_RESPONSE;

        int exitCode = app("sk-test").run(new String[]{"learn", COMMIT_URL});

        assertEquals(LearnerApp.EXIT_OK, exitCode);
        assertTrue(stdout().contains("No clear high-taste pattern detected in this commit"));
        assertFalse(Files.exists(rulesDir()));
    }

    @Test
    @DisplayName("learn without an API key fails before any request")
    void learn_missingApiKey() {
        int exitCode = app("").run(new String[]{"learn", COMMIT_URL});

        assertEquals(LearnerApp.EXIT_FAILURE, exitCode);
        assertTrue(stderr().contains("ANTHROPIC_API_KEY"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    @DisplayName("learn with a malformed URL reports the URL and exits 1")
    void learn_malformedUrl() {
        int exitCode = app("sk-test").run(new String[]{"--debug", "learn", "not-a-commit-url"});

        assertEquals(LearnerApp.EXIT_FAILURE, exitCode);
        assertTrue(stderr().contains("not-a-commit-url"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    @DisplayName("learn reports upstream failures with the URL")
    void learn_unknownCommit() {
        int exitCode = app("sk-test").run(new String[]{"learn", "https://github.com/octo/widgets/commit/fff"});

        assertEquals(LearnerApp.EXIT_FAILURE, exitCode);
        assertTrue(stderr().contains("/repos/octo/widgets/commits/fff"));
    }

    // =========================================================================
    // rules and check
    // =========================================================================

    @Test
    @DisplayName("rules lists what learn wrote")
    void rules_listsLearnedRules() {
        app("sk-test").run(new String[]{"learn", COMMIT_URL});
        out.reset();

        int exitCode = app(null).run(new String[]{"rules"});

        assertEquals(LearnerApp.EXIT_OK, exitCode);
        assertTrue(stdout().contains("Available rules (1 total):"));
        assertTrue(stdout().contains("Rule BND001: Validate before dereference"));
        assertTrue(stdout().contains("Category: boundaries"));
    }

    @Test
    @DisplayName("check prints violations and exits 1 when any are found")
    void check_reportsViolations() throws Exception {
        Path source = Files.writeString(tempDir.resolve("App.java"),
                "class App {\n    void run() {\n        System.out.println(\"hi\");\n    }\n}\n");

        int exitCode = app(null).run(new String[]{"check", source.toString()});

        assertEquals(LearnerApp.EXIT_FAILURE, exitCode);
        assertTrue(stdout().contains("Found 1 violations in 1 files"));
        assertTrue(stdout().contains(source + ":3:9"));
        assertTrue(stdout().contains("Summary by rule:"));
    }

    @Test
    @DisplayName("check exits 0 for clean files")
    void check_clean() throws Exception {
        Path source = Files.writeString(tempDir.resolve("Clean.java"), "class Clean {}\n");

        int exitCode = app(null).run(new String[]{"check", source.toString()});

        assertEquals(LearnerApp.EXIT_OK, exitCode);
        assertTrue(stdout().contains("No violations found in 1 files"));
    }

    @Test
    @DisplayName("check fails when no engine is installed")
    void check_noEngine() throws Exception {
        Path source = Files.writeString(tempDir.resolve("Clean.java"), "class Clean {}\n");
        AppConfig config = new AppConfig(null, null, rulesDir(), "http://unused", "http://unused");
        LearnerApp noEngine = new LearnerApp(() -> config, Optional::empty,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(LearnerApp.EXIT_FAILURE, noEngine.run(new String[]{"check", source.toString()}));
        assertTrue(stderr().contains("No rule-checking engine is installed"));
    }

    @Test
    @DisplayName("check skips files the engine does not support")
    void check_skipsUnsupportedFiles() throws Exception {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "System.out in prose\n");
        Path source = Files.writeString(tempDir.resolve("App.java"), "System.out.println(1);\n");

        int exitCode = app(null).run(new String[]{"check", notes.toString(), source.toString()});

        assertEquals(LearnerApp.EXIT_FAILURE, exitCode);
        assertTrue(stdout().contains("Skipping unsupported file: " + notes));
        assertTrue(stdout().contains("Found 1 violations in 1 files"));
    }

    @Test
    @DisplayName("check with only unsupported files has nothing to check")
    void check_onlyUnsupportedFiles() throws Exception {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "System.out\n");

        assertEquals(LearnerApp.EXIT_OK, app(null).run(new String[]{"check", notes.toString()}));
        assertTrue(stdout().contains("No files to check."));
    }

    @Test
    @DisplayName("Extension matching ignores case and accepts everything for an empty set")
    void isSupported() {
        assertTrue(LearnerApp.isSupported("src/App.JAVA", Set.of(".java")));
        assertFalse(LearnerApp.isSupported("README", Set.of(".java")));
        assertFalse(LearnerApp.isSupported("notes.txt", Set.of(".java")));
        assertTrue(LearnerApp.isSupported("notes.txt", Set.of()));
    }

    // =========================================================================
    // convert
    // =========================================================================

    @Test
    @DisplayName("convert writes YAML next to each markdown rule and keeps its id")
    void convert_writesYamlBesideMarkdown() throws Exception {
        Path dir = Files.createDirectories(rulesDir().resolve("boundaries"));
        Files.writeString(dir.resolve("guard.md"), "# Guard inputs\n**ID**: BND900\n**Category**: boundaries\n");
        Files.writeString(dir.resolve("untagged.md"), "# No id here\n");

        int exitCode = app("sk-test").run(new String[]{"convert"});

        Path yaml = dir.resolve("guard.yaml");
        assertEquals(LearnerApp.EXIT_OK, exitCode, stderr());
        assertTrue(stdout().contains("Converted BND900 to " + yaml));
        assertTrue(stdout().contains("Skipped " + dir.resolve("untagged.md")));
        assertTrue(stdout().contains("  Converted: 1"));
        assertTrue(Files.readString(yaml).contains("id: BND900\n"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("convert reports existing YAML as a failure and exits 1")
    void convert_existingYaml_fails() throws Exception {
        Path dir = Files.createDirectories(rulesDir().resolve("style"));
        Files.writeString(dir.resolve("names.md"), "# Names\n**ID**: STYLE900\n");
        Files.writeString(dir.resolve("names.yaml"), "title: kept\n");

        int exitCode = app("sk-test").run(new String[]{"convert"});

        assertEquals(LearnerApp.EXIT_FAILURE, exitCode);
        assertTrue(stderr().contains("Failed to convert " + dir.resolve("names.md")));
        assertEquals("title: kept\n", Files.readString(dir.resolve("names.yaml")));
    }

    // =========================================================================
    // Usage
    // =========================================================================

    @Test
    @DisplayName("Unknown command and missing arguments exit 2")
    void usageErrors() {
        assertEquals(LearnerApp.EXIT_USAGE, app(null).run(new String[]{}));
        assertEquals(LearnerApp.EXIT_USAGE, app(null).run(new String[]{"teach"}));
        assertEquals(LearnerApp.EXIT_USAGE, app(null).run(new String[]{"learn"}));
        assertEquals(LearnerApp.EXIT_USAGE, app(null).run(new String[]{"check"}));
        assertEquals(LearnerApp.EXIT_USAGE, app(null).run(new String[]{"convert", "extra"}));
        assertTrue(stderr().contains("Usage:"));
    }
}
