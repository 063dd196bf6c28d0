package com.hightaste.learner.config;

import com.hightaste.learner.client.GitHubApiClient;
import com.hightaste.learner.generation.AnthropicRuleGenerator;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Real environment variables
 * take precedence over the .env file.
 *
 * <p>Only the Anthropic key is required, and only for learning new rules;
 * see {@link #validate()}.</p>
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_RULES_DIR = "rules";

    private final String anthropicApiKey;
    private final String anthropicModel;
    private final String anthropicBaseUrl;
    private final String githubToken;
    private final String githubApiUrl;
    private final Path rulesDir;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.anthropicApiKey = resolve(dotenv, "ANTHROPIC_API_KEY", "");
        this.anthropicModel = resolve(dotenv, "ANTHROPIC_MODEL", AnthropicRuleGenerator.DEFAULT_MODEL);
        this.anthropicBaseUrl = resolve(dotenv, "ANTHROPIC_BASE_URL", AnthropicRuleGenerator.DEFAULT_BASE_URL);
        this.githubToken = resolve(dotenv, "GITHUB_TOKEN", null);
        this.githubApiUrl = resolve(dotenv, "GITHUB_API_URL", GitHubApiClient.DEFAULT_BASE_URL);
        this.rulesDir = Path.of(resolve(dotenv, "RULES_DIR", DEFAULT_RULES_DIR));

        logger.info("Configuration loaded: rulesDir={}, model={}, githubToken={}",
                rulesDir, anthropicModel, githubToken != null ? "set" : "not set");
    }

    /**
     * Constructor for testing: accepts values directly.
     */
    public AppConfig(String anthropicApiKey, String githubToken, Path rulesDir,
                     String githubApiUrl, String anthropicBaseUrl) {
        this.anthropicApiKey = anthropicApiKey;
        this.anthropicModel = AnthropicRuleGenerator.DEFAULT_MODEL;
        this.anthropicBaseUrl = anthropicBaseUrl;
        this.githubToken = githubToken;
        this.githubApiUrl = githubApiUrl;
        this.rulesDir = rulesDir;
    }

    /**
     * Fails when a variable needed to learn rules is missing.
     */
    public void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(anthropicApiKey)) missing.append("ANTHROPIC_API_KEY ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }
    }

    private static String resolve(Dotenv dotenv, String key, String defaultValue) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null && !dotenvValue.isBlank() ? dotenvValue : defaultValue;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public String getAnthropicModel() {
        return anthropicModel;
    }

    public String getAnthropicBaseUrl() {
        return anthropicBaseUrl;
    }

    public String getGithubToken() {
        return githubToken;
    }

    public String getGithubApiUrl() {
        return githubApiUrl;
    }

    public Path getRulesDir() {
        return rulesDir;
    }
}
