package dev.quorum.domain.valueobject;

/**
 * Identifies the pull request revision a run reviews.
 */
public record PullRequestRef(long installationId, String repoFullName, int prNumber,
                             String title, String commitSha) {

    public String owner() {
        int slash = repoFullName.indexOf('/');
        return slash > 0 ? repoFullName.substring(0, slash) : repoFullName;
    }

    public String repoName() {
        int slash = repoFullName.indexOf('/');
        return slash > 0 ? repoFullName.substring(slash + 1) : repoFullName;
    }

    public String shortSha() {
        return commitSha.length() > 7 ? commitSha.substring(0, 7) : commitSha;
    }
}
