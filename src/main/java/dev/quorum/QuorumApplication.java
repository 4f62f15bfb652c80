package dev.quorum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Quorum: multi-agent pull request review service.
 *
 * <p>Pipeline overview:
 * <pre>
 * GitHub Webhook → WebhookController → WebhookGateway (HMAC, parse)
 *   → CredentialVault (decrypt per-installation key, run-scoped)
 *   → AgentDispatcher → [security, logic, performance, style] in parallel
 *   → ResultSynthesizer (dedupe, order, cap) → GitHub review comment
 *   → ReviewRecorder (one outcome row per run)
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Synchronous run per delivery: the webhook answers once the outcome is recorded</li>
 *   <li>Partial failure is normal: a run completes if at least one agent answered</li>
 *   <li>Agents are rows in a fixed table, not classes; one dispatcher drives them all</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QuorumApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuorumApplication.class, args);
    }
}
