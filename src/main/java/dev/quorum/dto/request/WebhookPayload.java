package dev.quorum.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * The slice of GitHub's pull_request and installation event bodies we read.
 * Fields are nullable so absence can be reported instead of defaulted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookPayload(
        String action,
        @JsonProperty("pull_request") PullRequest pullRequest,
        Repository repository,
        Installation installation
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(Integer number, String title, Head head) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(String sha, String ref) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("full_name") String fullName, Account owner) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Installation(Long id, Account account) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Account(String login, String type) {}

    public boolean isActionable() {
        return "opened".equals(action) || "synchronize".equals(action);
    }

    public Long installationId() {
        return installation != null ? installation.id() : null;
    }

    /**
     * Names of the fields a pull request run cannot start without.
     */
    public List<String> missingPullRequestFields() {
        List<String> missing = new ArrayList<>();
        if (installationId() == null) missing.add("installation.id");
        if (repository == null || isBlank(repository.fullName()) || !repository.fullName().contains("/"))
            missing.add("repository.full_name");
        if (pullRequest == null || pullRequest.number() == null || pullRequest.number() <= 0)
            missing.add("pull_request.number");
        if (pullRequest == null || pullRequest.head() == null || isBlank(pullRequest.head().sha()))
            missing.add("pull_request.head.sha");
        return missing;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
