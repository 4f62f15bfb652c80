package dev.quorum.infrastructure.github;

import dev.quorum.domain.enums.ReviewVerdict;
import dev.quorum.domain.valueobject.CodeFile;
import dev.quorum.domain.valueobject.PullRequestRef;

import java.util.List;

/**
 * The source-control side of a run: read the changed files, post the result.
 */
public interface PullRequestClient {

    List<CodeFile> getPullRequestFiles(PullRequestRef pr);

    void postReview(PullRequestRef pr, String body, ReviewVerdict verdict);
}
