package dev.quorum.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quorum.agent.orchestrator.ReviewPipeline;
import dev.quorum.domain.enums.OwnerType;
import dev.quorum.domain.valueobject.PullRequestRef;
import dev.quorum.dto.request.WebhookPayload;
import dev.quorum.infrastructure.github.WebhookSignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Entry point for every GitHub delivery: authenticate, classify, parse, then hand
 * pull request events to the review pipeline and installation events to the
 * installation lifecycle.
 *
 * <p>The signature is checked over the raw bytes before anything is parsed.
 * Rejected and ignored deliveries create no Review row.
 */
@Service
public class WebhookGateway {

    private static final Logger log = LoggerFactory.getLogger(WebhookGateway.class);

    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    static final String EVENT_HEADER = "X-GitHub-Event";
    static final String DELIVERY_HEADER = "X-GitHub-Delivery";

    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final ReviewPipeline pipeline;
    private final InstallationService installationService;

    public WebhookGateway(WebhookSignatureVerifier signatureVerifier,
                          ObjectMapper objectMapper,
                          ReviewPipeline pipeline,
                          InstallationService installationService) {
        this.signatureVerifier = signatureVerifier;
        this.objectMapper = objectMapper;
        this.pipeline = pipeline;
        this.installationService = installationService;
    }

    public WebhookOutcome handle(byte[] body, Map<String, String> headers) {
        Map<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        h.putAll(headers);
        String deliveryId = h.get(DELIVERY_HEADER);
        if (deliveryId == null || deliveryId.isBlank()) {
            deliveryId = UUID.randomUUID().toString();
        }

        MDC.put("deliveryId", deliveryId);
        try {
            if (!signatureVerifier.isValid(body, h.get(SIGNATURE_HEADER))) {
                log.warn("Webhook signature verification failed");
                return WebhookOutcome.signatureInvalid();
            }

            String event = h.getOrDefault(EVENT_HEADER, "");
            return switch (event) {
                case "pull_request" -> onPullRequest(deliveryId, body);
                case "installation" -> onInstallation(body);
                default -> {
                    log.debug("Ignoring {} event", event.isEmpty() ? "untyped" : event);
                    yield WebhookOutcome.ignored("event not handled: " + event);
                }
            };
        } finally {
            MDC.remove("deliveryId");
        }
    }

    private WebhookOutcome onPullRequest(String deliveryId, byte[] body) {
        WebhookPayload payload = parse(body);
        if (payload == null) return WebhookOutcome.malformed("body is not valid JSON");

        if (!payload.isActionable()) {
            log.debug("Ignoring pull_request action {}", payload.action());
            return WebhookOutcome.ignored("action not tracked: " + payload.action());
        }

        List<String> missing = payload.missingPullRequestFields();
        if (!missing.isEmpty()) {
            log.warn("pull_request payload missing {}", missing);
            return WebhookOutcome.malformed("missing fields: " + String.join(", ", missing));
        }

        WebhookPayload.PullRequest pr = payload.pullRequest();
        PullRequestRef ref = new PullRequestRef(payload.installationId(), payload.repository().fullName(),
                pr.number(), pr.title(), pr.head().sha());
        log.info("Webhook: pull_request {} on {}#{}", payload.action(), ref.repoFullName(), ref.prNumber());

        WebhookPayload.Account owner = payload.repository().owner();
        return pipeline.run(deliveryId, ref,
                owner != null ? owner.login() : ref.owner(),
                owner != null ? OwnerType.fromGitHub(owner.type()) : OwnerType.USER);
    }

    private WebhookOutcome onInstallation(byte[] body) {
        WebhookPayload payload = parse(body);
        if (payload == null) return WebhookOutcome.malformed("body is not valid JSON");
        Long installationId = payload.installationId();
        if (installationId == null) return WebhookOutcome.malformed("missing fields: installation.id");

        String action = payload.action() == null ? "" : payload.action();
        switch (action) {
            case "created" -> {
                WebhookPayload.Account account = payload.installation().account();
                installationService.registerOrReactivate(installationId,
                        account != null ? account.login() : null,
                        account != null ? OwnerType.fromGitHub(account.type()) : OwnerType.USER);
            }
            case "deleted", "suspend" -> installationService.setEnabled(installationId, false);
            case "unsuspend" -> installationService.setEnabled(installationId, true);
            default -> {
                return WebhookOutcome.ignored("installation action not tracked: " + action);
            }
        }
        log.info("Webhook: installation {} for {}", action, installationId);
        return WebhookOutcome.processed(null);
    }

    private WebhookPayload parse(byte[] body) {
        try {
            WebhookPayload payload = objectMapper.readValue(body, WebhookPayload.class);
            if (payload == null) log.warn("Webhook body is empty");
            return payload;
        } catch (IOException e) {
            log.warn("Webhook body could not be parsed: {}", e.getMessage());
            return null;
        }
    }
}
