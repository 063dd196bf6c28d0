package com.hightaste.learner.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hightaste.learner.model.Commit;
import com.hightaste.learner.model.CommitRecord;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST API client that resolves a commit URL into its message and unified diff.
 *
 * <p>Each read is attempted at most twice: a transport failure or a transient
 * status (429, 5xx gateway errors) is retried once after a short backoff.
 * Any other non-success status fails immediately.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.github.com";
    static final String JSON_MEDIA_TYPE = "application/vnd.github+json";
    static final String DIFF_MEDIA_TYPE = "application/vnd.github.diff";
    static final String API_VERSION = "2022-11-28";

    private static final int MAX_ATTEMPTS = 2;
    private static final long DEFAULT_BACKOFF_MS = 1_000;
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);

    static final List<Pattern> COMMIT_URL_PATTERNS = List.of(
            Pattern.compile("github\\.com/([^/]+)/([^/]+)/commit/([a-f0-9]+)"),
            Pattern.compile("github\\.com/([^/]+)/([^/]+)/commits/([a-f0-9]+)"));

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String token;
    private final long backoffMs;

    /**
     * @param baseUrl API root, e.g. {@value #DEFAULT_BASE_URL}
     * @param token   optional token; {@code null} or blank means unauthenticated requests
     */
    public GitHubApiClient(String baseUrl, String token) {
        this(baseUrl, token, defaultHttpClient(), DEFAULT_BACKOFF_MS);
    }

    public GitHubApiClient(String baseUrl, String token, OkHttpClient httpClient, long backoffMs) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.token = token;
        this.httpClient = httpClient;
        this.backoffMs = backoffMs;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    // -------------------------------------------------------------------------
    // URL parsing
    // -------------------------------------------------------------------------

    /**
     * Parses a GitHub commit URL of the form {@code github.com/<owner>/<repo>/commit/<sha>}
     * or {@code github.com/<owner>/<repo>/commits/<sha>}. The revision must be lowercase hex.
     */
    public static CommitReference parseCommitUrl(String url) throws InvalidCommitReferenceException {
        if (url == null) {
            throw new InvalidCommitReferenceException("null");
        }
        for (Pattern pattern : COMMIT_URL_PATTERNS) {
            Matcher matcher = pattern.matcher(url);
            if (matcher.find()) {
                return new CommitReference(matcher.group(1), matcher.group(2), matcher.group(3));
            }
        }
        throw new InvalidCommitReferenceException(url);
    }

    // -------------------------------------------------------------------------
    // Public API endpoint methods
    // -------------------------------------------------------------------------

    /**
     * Fetches the commit message and the diff for a commit.
     * Endpoint: GET /repos/{owner}/{repo}/commits/{ref}, once as JSON and once as a diff.
     */
    public CommitRecord fetchCommit(CommitReference ref)
            throws UpstreamUnavailableException, InterruptedException {
        String url = baseUrl + "/repos/" + ref.repoFullName() + "/commits/" + ref.revision();

        String json = executeWithRetry(buildRequest(url, JSON_MEDIA_TYPE));
        String message = parseCommitMessage(json, url);

        String diff = executeWithRetry(buildRequest(url, DIFF_MEDIA_TYPE));
        logger.debug("Fetched diff for {} ({} chars)", ref.revision(), diff.length());

        return new CommitRecord(message, diff,
                "https://github.com/" + ref.repoFullName() + "/commit/" + ref.revision());
    }

    String parseCommitMessage(String json, String url) throws UpstreamUnavailableException {
        Commit commit;
        try {
            commit = objectMapper.readValue(json, Commit.class);
        } catch (IOException e) {
            throw new UpstreamUnavailableException("Unreadable commit JSON from " + url, e);
        }
        if (commit.commit() == null || commit.commit().message() == null) {
            throw new UpstreamUnavailableException("No commit.message in response from " + url, 200);
        }
        return commit.commit().message();
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with a single retry
    // -------------------------------------------------------------------------

    /**
     * Builds a GET request with the requested media type, and authentication when a token is set.
     */
    Request buildRequest(String url, String accept) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", accept)
                .header("X-GitHub-Api-Version", API_VERSION);

        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        return builder.build();
    }

    /**
     * Executes a request, retrying once on a transport failure or transient status,
     * and returns the response body.
     */
    String executeWithRetry(Request request) throws UpstreamUnavailableException, InterruptedException {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            boolean lastAttempt = attempt == MAX_ATTEMPTS;
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logResponse(request.url().toString(), statusCode, response);

                if (TRANSIENT_STATUSES.contains(statusCode)) {
                    if (lastAttempt) {
                        throw new UpstreamUnavailableException("GitHub API error: " + statusCode
                                + " for " + request.url() + " (after retry)", statusCode);
                    }
                    long waitMs = getRetryWaitMs(response);
                    logger.warn("Received {} from {}. Retrying in {}ms", statusCode, request.url(), waitMs);
                    Thread.sleep(waitMs);
                    continue;
                }

                if (statusCode < 200 || statusCode >= 300) {
                    throw new UpstreamUnavailableException(
                            "GitHub API error: " + statusCode + " for " + request.url(), statusCode);
                }

                ResponseBody body = response.body();
                return body != null ? body.string() : "";
            } catch (IOException e) {
                if (lastAttempt) {
                    throw new UpstreamUnavailableException("GitHub API unreachable: " + request.url(), e);
                }
                logger.warn("Request to {} failed ({}). Retrying in {}ms",
                        request.url(), e.getMessage(), backoffMs);
                Thread.sleep(backoffMs);
            }
        }

        throw new UpstreamUnavailableException("Exhausted retries for " + request.url(), -1);
    }

    /**
     * Uses the Retry-After header (seconds) if present, otherwise the configured backoff.
     */
    long getRetryWaitMs(Response response) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Long.parseLong(retryAfter.trim()) * 1_000;
            } catch (NumberFormatException ignored) {
                // fall through to backoff
            }
        }
        return backoffMs;
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(String url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
