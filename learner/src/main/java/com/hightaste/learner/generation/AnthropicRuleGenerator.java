package com.hightaste.learner.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hightaste.learner.model.Rule;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Generates rules through the Anthropic Messages API ({@code POST /v1/messages}).
 *
 * <p>The model is forced to answer through a single {@value #TOOL_NAME} tool whose
 * input schema is the rule shape, so the answer arrives as structured JSON.
 * Calls are never retried.</p>
 */
public class AnthropicRuleGenerator implements RuleGenerator {

    private static final Logger logger = LoggerFactory.getLogger(AnthropicRuleGenerator.class);

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
    static final String API_VERSION = "2023-06-01";
    static final String TOOL_NAME = "record_rule";
    static final double TEMPERATURE = 0.2;
    static final int MAX_TOKENS = 8000;

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final String baseUrl;

    public AnthropicRuleGenerator(String apiKey, String model, String baseUrl) {
        this(apiKey, model, baseUrl, defaultHttpClient());
    }

    public AnthropicRuleGenerator(String apiKey, String model, String baseUrl, OkHttpClient httpClient) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("ANTHROPIC_API_KEY is required");
        }
        this.apiKey = apiKey;
        this.model = (model == null || model.isBlank()) ? DEFAULT_MODEL : model;
        String url = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : baseUrl;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(180, TimeUnit.SECONDS)
                .writeTimeout(60, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public Rule generate(String prompt) throws GenerationFailedException {
        logger.info("Sending request to Anthropic API (model: {})", model);
        logger.debug("Prompt being sent:\n{}", prompt);

        Request request = buildRequest(prompt);
        String responseBody;
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            responseBody = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new GenerationFailedException(
                        "Anthropic API error " + response.code() + ": " + responseBody);
            }
        } catch (IOException e) {
            throw new GenerationFailedException("Anthropic API unreachable at " + request.url(), e);
        }

        Rule rule = parseResponse(responseBody);
        logger.info("Received complete response from Anthropic API");
        logger.debug("Generated rule title: {}", rule.title());
        logger.debug("Number of examples: {}", rule.examples().size());
        return rule;
    }

    Request buildRequest(String prompt) throws GenerationFailedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", MAX_TOKENS);
        body.put("temperature", TEMPERATURE);
        body.put("system", RulePrompts.SYSTEM_PROMPT);

        ObjectNode tool = body.putArray("tools").addObject();
        tool.put("name", TOOL_NAME);
        tool.put("description", "Record the coding rule extracted from the commit.");
        tool.set("input_schema", ruleSchema());

        body.putObject("tool_choice")
                .put("type", "tool")
                .put("name", TOOL_NAME);

        body.putArray("messages").addObject()
                .put("role", "user")
                .put("content", prompt);

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GenerationFailedException("Could not encode Anthropic request", e);
        }

        return new Request.Builder()
                .url(baseUrl + "/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .post(RequestBody.create(json, JSON))
                .build();
    }

    /**
     * Extracts the {@value #TOOL_NAME} tool input from a Messages API response and binds it to a rule.
     */
    Rule parseResponse(String responseBody) throws GenerationFailedException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new GenerationFailedException("Anthropic response is not valid JSON", e);
        }

        if ("max_tokens".equals(root.path("stop_reason").asText())) {
            throw new GenerationFailedException(
                    "Anthropic response was truncated at " + MAX_TOKENS + " tokens");
        }

        JsonNode input = null;
        for (JsonNode block : root.path("content")) {
            if ("tool_use".equals(block.path("type").asText())
                    && TOOL_NAME.equals(block.path("name").asText())) {
                input = block.get("input");
                break;
            }
        }
        if (input == null) {
            throw new GenerationFailedException("Anthropic response has no " + TOOL_NAME + " tool call");
        }

        List<String> problems = GeneratedRuleValidator.validate(input);
        if (!problems.isEmpty()) {
            throw new GenerationFailedException("Generated rule is invalid: " + String.join("; ", problems));
        }

        try {
            return objectMapper.treeToValue(input, Rule.class);
        } catch (JsonProcessingException e) {
            throw new GenerationFailedException("Generated rule could not be read", e);
        }
    }

    private ObjectNode ruleSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("category").put("type", "string");
        properties.putObject("title").put("type", "string")
                .put("description", "Empty when the commit shows no generalizable pattern");
        properties.putObject("id").put("type", "string");
        properties.putObject("description").put("type", "string");
        properties.set("problems", stringArray());
        properties.set("solutions", stringArray());

        ObjectNode example = objectMapper.createObjectNode();
        example.put("type", "object");
        ObjectNode exampleProperties = example.putObject("properties");
        exampleProperties.putObject("scenario").put("type", "string");
        exampleProperties.putObject("before").put("type", "string");
        exampleProperties.putObject("after").put("type", "string");
        example.putArray("required").add("scenario").add("before").add("after");

        ObjectNode examples = properties.putObject("examples");
        examples.put("type", "array");
        examples.set("items", example);

        ArrayNode required = schema.putArray("required");
        for (String field : List.of("category", "title", "description", "problems", "solutions", "examples")) {
            required.add(field);
        }
        return schema;
    }

    private ObjectNode stringArray() {
        ObjectNode array = objectMapper.createObjectNode();
        array.put("type", "array");
        array.putObject("items").put("type", "string");
        return array;
    }
}
