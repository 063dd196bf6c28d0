package com.hightaste.learner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object for a single GitHub commit.
 * Maps from the nested GitHub API response: /repos/{owner}/{repo}/commits/{ref}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Commit(
        @JsonProperty("sha") String sha,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("commit") CommitDetail commit
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommitDetail(
            @JsonProperty("message") String message
    ) {}
}
