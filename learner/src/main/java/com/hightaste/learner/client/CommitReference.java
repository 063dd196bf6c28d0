package com.hightaste.learner.client;

/**
 * Identifies a commit on GitHub: repository owner, repository name and revision.
 */
public record CommitReference(String owner, String repo, String revision) {

    public String repoFullName() {
        return owner + "/" + repo;
    }
}
