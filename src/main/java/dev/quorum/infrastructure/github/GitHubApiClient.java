package dev.quorum.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.quorum.config.GitHubProperties;
import dev.quorum.domain.enums.ReviewVerdict;
import dev.quorum.domain.valueobject.CodeFile;
import dev.quorum.domain.valueobject.PullRequestRef;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * GitHub REST client with circuit breaker and rate limiting.
 * WebClient with .block(): callers are the synchronous webhook run.
 */
@Component
public class GitHubApiClient implements PullRequestClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);
    private static final int FILES_PER_PAGE = 100;
    private static final int MAX_PAGES = 30;

    private final WebClient webClient;
    private final GitHubTokenProvider tokenProvider;

    public GitHubApiClient(WebClient.Builder builder, GitHubTokenProvider tokenProvider, GitHubProperties properties) {
        this.tokenProvider = tokenProvider;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(30))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        this.webClient = builder.baseUrl(properties.apiUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .build();
    }

    /**
     * All changed files across pages. Deleted files are skipped: there is nothing left to review.
     */
    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public List<CodeFile> getPullRequestFiles(PullRequestRef pr) {
        String token = tokenProvider.getInstallationToken(pr.installationId());
        List<CodeFile> allFiles = new ArrayList<>();

        for (int page = 1; page <= MAX_PAGES; page++) {
            List<ChangedFile> files = webClient.get()
                    .uri("/repos/{owner}/{repo}/pulls/{number}/files?per_page={perPage}&page={page}",
                            Map.of("owner", pr.owner(), "repo", pr.repoName(), "number", pr.prNumber(),
                                    "perPage", FILES_PER_PAGE, "page", page))
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<List<ChangedFile>>() {})
                    .block();

            if (files == null || files.isEmpty()) break;

            files.stream()
                    .filter(f -> !"removed".equals(f.status()))
                    .map(f -> new CodeFile(f.filename(), CodeFile.detectLanguage(f.filename()),
                            f.patch(), f.additions(), f.deletions()))
                    .forEach(allFiles::add);

            if (files.size() < FILES_PER_PAGE) break;
        }

        log.debug("Fetched {} changed file(s) for {}#{}", allFiles.size(), pr.repoFullName(), pr.prNumber());
        return allFiles;
    }

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public void postReview(PullRequestRef pr, String body, ReviewVerdict verdict) {
        String token = tokenProvider.getInstallationToken(pr.installationId());
        webClient.post()
                .uri("/repos/{owner}/{repo}/pulls/{number}/reviews",
                        Map.of("owner", pr.owner(), "repo", pr.repoName(), "number", pr.prNumber()))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .bodyValue(Map.of("commit_id", pr.commitSha(), "body", body, "event", verdict.name()))
                .retrieve()
                .toBodilessEntity()
                .block();
        log.info("Review posted on {}#{} ({})", pr.repoFullName(), pr.prNumber(), verdict);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChangedFile(String filename, String status, String patch, int additions, int deletions) {}
}
