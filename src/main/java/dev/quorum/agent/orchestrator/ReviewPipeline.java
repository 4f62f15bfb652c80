package dev.quorum.agent.orchestrator;

import dev.quorum.agent.AgentDefinition;
import dev.quorum.agent.AgentRegistry;
import dev.quorum.agent.DispatchResult;
import dev.quorum.agent.synthesis.ReportRenderer;
import dev.quorum.agent.synthesis.ResultSynthesizer;
import dev.quorum.config.DispatchProperties;
import dev.quorum.domain.entity.Installation;
import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.OwnerType;
import dev.quorum.domain.enums.ReviewVerdict;
import dev.quorum.domain.valueobject.PullRequestRef;
import dev.quorum.domain.valueobject.ReviewDiff;
import dev.quorum.domain.valueobject.ReviewSettings;
import dev.quorum.domain.valueobject.SynthesizedReport;
import dev.quorum.exception.CredentialException;
import dev.quorum.infrastructure.crypto.ApiCredential;
import dev.quorum.infrastructure.crypto.CredentialVault;
import dev.quorum.infrastructure.github.PullRequestClient;
import dev.quorum.service.InstallationService;
import dev.quorum.service.PendingReview;
import dev.quorum.service.ReviewRecorder;
import dev.quorum.service.RunOutcome;
import dev.quorum.service.WebhookOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One review run for one pull request delivery.
 *
 * <pre>
 *  1. Resolve the installation (register it if unseen); skip disabled ones and redeliveries
 *  2. Open the PENDING Review row
 *  3. Acquire the run-scoped credential
 *  4. Fetch changed files, keep the reviewable ones
 *  5. Fan out to the enabled agents
 *  6. Synthesize and render the report
 *  7. Finalize the Review, then post the comment
 * </pre>
 *
 * <p>The run deadline counts from the moment the delivery reaches the pipeline, so
 * fetching files eats into the agents' budget. The credential is closed when
 * dispatch returns, on every path. No transaction
 * spans the run: the recorder opens and finalizes the row in short transactions
 * of its own, so a database failure never stops the comment from being posted.
 */
@Component
public class ReviewPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReviewPipeline.class);

    private final InstallationService installationService;
    private final ReviewRecorder recorder;
    private final CredentialVault vault;
    private final PullRequestClient pullRequests;
    private final AgentRegistry registry;
    private final AgentDispatcher dispatcher;
    private final ResultSynthesizer synthesizer;
    private final ReportRenderer renderer;
    private final DispatchProperties dispatchProperties;
    private final MeterRegistry meterRegistry;

    public ReviewPipeline(InstallationService installationService,
                          ReviewRecorder recorder,
                          CredentialVault vault,
                          PullRequestClient pullRequests,
                          AgentRegistry registry,
                          AgentDispatcher dispatcher,
                          ResultSynthesizer synthesizer,
                          ReportRenderer renderer,
                          DispatchProperties dispatchProperties,
                          MeterRegistry meterRegistry) {
        this.installationService = installationService;
        this.recorder = recorder;
        this.vault = vault;
        this.pullRequests = pullRequests;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.synthesizer = synthesizer;
        this.renderer = renderer;
        this.dispatchProperties = dispatchProperties;
        this.meterRegistry = meterRegistry;
    }

    public WebhookOutcome run(String deliveryId, PullRequestRef pr, String ownerLogin, OwnerType ownerType) {
        long started = System.nanoTime();
        Installation installation;
        try {
            installation = installationService.resolveForPullRequest(pr.installationId(), ownerLogin, ownerType);
        } catch (DataAccessException e) {
            log.error("Could not resolve installation {} for {}#{}: {}",
                    pr.installationId(), pr.repoFullName(), pr.prNumber(), e.getMessage());
            return WebhookOutcome.ignored("installation store unavailable");
        }
        if (!installation.isEnabled()) {
            log.info("Installation {} is disabled, skipping {}#{}", pr.installationId(), pr.repoFullName(), pr.prNumber());
            return WebhookOutcome.ignored("installation disabled");
        }
        if (recorder.alreadyRecorded(deliveryId)) {
            log.info("Delivery {} already reviewed, skipping", deliveryId);
            return WebhookOutcome.ignored("duplicate delivery");
        }

        PendingReview pending = recorder.open(installation.getId(), deliveryId, pr);
        if (pending.duplicateDelivery()) {
            return WebhookOutcome.ignored("duplicate delivery");
        }
        Optional<UUID> reviewId = pending.id();
        reviewId.ifPresent(id -> MDC.put("reviewId", id.toString()));
        try {
            log.info("Review started for {}#{} at {}", pr.repoFullName(), pr.prNumber(), pr.shortSha());
            Conclusion conclusion = execute(pr, installation.reviewSettings(), started);

            reviewId.ifPresent(id -> recorder.finalizeReview(id, conclusion.outcome()));
            conclusion.comment().ifPresent(body -> post(pr, body, conclusion.verdict()));

            Duration elapsed = elapsedSince(started);
            meterRegistry.timer("quorum.pipeline.duration",
                    "outcome", conclusion.outcome().completed() ? "completed" : "failed").record(elapsed);
            log.info("Review finished for {}#{} in {} ms: {}", pr.repoFullName(), pr.prNumber(), elapsed.toMillis(),
                    conclusion.outcome().completed() ? "completed" : "failed: " + conclusion.outcome().errorMessage());
            return WebhookOutcome.processed(reviewId.orElse(null));
        } finally {
            MDC.remove("reviewId");
        }
    }

    private Conclusion execute(PullRequestRef pr, ReviewSettings settings, long started) {
        int filesReviewed = 0;
        try (ApiCredential credential = vault.resolve(pr.installationId())) {
            ReviewDiff diff = ReviewDiff.of(pullRequests.getPullRequestFiles(pr));
            filesReviewed = diff.fileCount();
            List<AgentDefinition> agents = registry.enabledFor(settings);

            if (diff.isEmpty() || agents.isEmpty()) {
                log.info("Nothing to review ({} reviewable file(s), {} agent(s) enabled)", filesReviewed, agents.size());
                return Conclusion.silent(RunOutcome.completed(filesReviewed, zeroCounts(), elapsedSince(started)));
            }

            long deadline = started + dispatchProperties.runDeadline().toNanos();
            DispatchResult dispatch = dispatcher.run(diff, agents, credential, deadline);
            if (dispatch.allFailed()) {
                String statuses = dispatch.statuses().entrySet().stream()
                        .map(e -> e.getKey().key() + "=" + e.getValue().name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", "));
                log.warn("All agents failed: {}", statuses);
                return new Conclusion(
                        RunOutcome.failed(filesReviewed, "All review agents failed (" + statuses + ")",
                                elapsedSince(started)),
                        Optional.of(renderer.renderAllAgentsFailed(pr)), ReviewVerdict.COMMENT);
            }

            SynthesizedReport report = synthesizer.synthesize(dispatch.findings());
            return new Conclusion(
                    RunOutcome.completed(filesReviewed, report.issuesByTypeKeys(), elapsedSince(started)),
                    Optional.of(renderer.render(pr, report)),
                    renderer.verdict(report, settings.autoApprove()));
        } catch (CredentialException e) {
            log.warn("Installation {} cannot be reviewed: {}", pr.installationId(), e.getMessage());
            return new Conclusion(
                    RunOutcome.failed(filesReviewed, e.userMessage(), elapsedSince(started)),
                    Optional.of(renderer.renderConfigurationProblem(pr, e.userMessage())), ReviewVerdict.COMMENT);
        } catch (RuntimeException e) {
            log.error("Review run for {}#{} failed: {}", pr.repoFullName(), pr.prNumber(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Conclusion.silent(RunOutcome.failed(filesReviewed, message, elapsedSince(started)));
        }
    }

    private void post(PullRequestRef pr, String body, ReviewVerdict verdict) {
        try {
            pullRequests.postReview(pr, body, verdict);
        } catch (RuntimeException e) {
            log.error("Could not post review on {}#{}: {}", pr.repoFullName(), pr.prNumber(), e.getMessage());
        }
    }

    private static Map<String, Integer> zeroCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AgentRole role : AgentRole.values()) counts.put(role.key(), 0);
        return counts;
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private record Conclusion(RunOutcome outcome, Optional<String> comment, ReviewVerdict verdict) {
        static Conclusion silent(RunOutcome outcome) {
            return new Conclusion(outcome, Optional.empty(), ReviewVerdict.COMMENT);
        }
    }
}
