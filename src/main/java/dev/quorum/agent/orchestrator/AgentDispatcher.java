package dev.quorum.agent.orchestrator;

import dev.quorum.agent.AgentCallResult;
import dev.quorum.agent.AgentDefinition;
import dev.quorum.agent.AgentOutcome;
import dev.quorum.agent.DispatchResult;
import dev.quorum.agent.FindingParser;
import dev.quorum.agent.PromptUtils;
import dev.quorum.config.AiProperties;
import dev.quorum.config.DispatchProperties;
import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.valueobject.Finding;
import dev.quorum.domain.valueobject.ReviewDiff;
import dev.quorum.infrastructure.ai.ModelInvoker;
import dev.quorum.infrastructure.crypto.ApiCredential;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one diff out to every enabled agent and collects what comes back.
 *
 * <p>Per agent: up to {@code maxRetries + 1} attempts, each bounded by the call
 * timeout. Transient failures and timeouts back off exponentially from
 * {@code baseBackoff}, or wait the provider's Retry-After hint when that is
 * longer; permanent failures stop that agent at once. The caller's run deadline
 * bounds everything: agents still outstanding when it passes are recorded as
 * TIMEOUT and dispatch returns with whatever was collected.
 *
 * <p>The credential is only read inside calls started before this method returns.
 */
@Component
public class AgentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatcher.class);

    private final ModelInvoker modelInvoker;
    private final FindingParser findingParser;
    private final DispatchProperties dispatchProperties;
    private final AiProperties aiProperties;
    private final ExecutorService agentExecutor;
    private final MeterRegistry meterRegistry;
    private final IntervalFunction backoff;

    public AgentDispatcher(ModelInvoker modelInvoker,
                           FindingParser findingParser,
                           DispatchProperties dispatchProperties,
                           AiProperties aiProperties,
                           @Qualifier("agentExecutorService") ExecutorService agentExecutor,
                           MeterRegistry meterRegistry) {
        this.modelInvoker = modelInvoker;
        this.findingParser = findingParser;
        this.dispatchProperties = dispatchProperties;
        this.aiProperties = aiProperties;
        this.agentExecutor = agentExecutor;
        this.meterRegistry = meterRegistry;
        this.backoff = IntervalFunction.ofExponentialBackoff(dispatchProperties.baseBackoff(), 2.0);
    }

    /**
     * @param deadline the run deadline on the {@link System#nanoTime()} clock
     */
    public DispatchResult run(ReviewDiff diff, List<AgentDefinition> agents, ApiCredential credential, long deadline) {
        if (agents.isEmpty()) {
            return DispatchResult.empty();
        }
        String diffText = diff.toPromptText(aiProperties.maxDiffChars());

        Map<AgentRole, CompletableFuture<AgentOutcome>> futures = new EnumMap<>(AgentRole.class);
        for (AgentDefinition agent : agents) {
            futures.put(agent.role(), CompletableFuture.supplyAsync(
                    () -> runAgent(agent, diffText, diff, credential, deadline), agentExecutor));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                    .get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Run deadline reached with agents outstanding");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for agents");
        } catch (ExecutionException e) {
            log.error("Agent task failed unexpectedly", e.getCause());
        }

        List<AgentOutcome> outcomes = new ArrayList<>();
        futures.forEach((role, future) -> {
            AgentOutcome outcome = collect(role, future);
            outcomes.add(outcome);
            meterRegistry.counter("quorum.agent.calls",
                    "agent", role.key(), "status", outcome.status().name().toLowerCase(Locale.ROOT)).increment();
        });
        return DispatchResult.of(outcomes);
    }

    private AgentOutcome collect(AgentRole role, CompletableFuture<AgentOutcome> future) {
        if (!future.isDone()) {
            future.cancel(true);
            return AgentOutcome.timeout(role);
        }
        try {
            return future.getNow(AgentOutcome.timeout(role));
        } catch (RuntimeException e) {
            log.error("{} agent task threw", role.key(), e);
            return AgentOutcome.error(role, e.getClass().getSimpleName());
        }
    }

    private AgentOutcome runAgent(AgentDefinition agent, String diffText, ReviewDiff diff,
                                  ApiCredential credential, long deadline) {
        AgentRole role = agent.role();
        MDC.put("agent", role.key());
        try {
            String prompt = PromptUtils.render(agent, diffText);
            int maxAttempts = dispatchProperties.maxAttempts();
            AgentCallResult last = AgentCallResult.timeout();

            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("{} agent: run deadline passed before attempt {}", role.key(), attempt);
                    return AgentOutcome.timeout(role);
                }

                last = callOnce(role, prompt, credential,
                        Math.min(dispatchProperties.callTimeout().toNanos(), remaining));

                if (last.kind() == AgentCallResult.Kind.OK) {
                    return parse(role, last.text(), diff);
                }
                if (!last.isRetryable()) {
                    log.warn("{} agent failed permanently: {}", role.key(), last.reason());
                    return AgentOutcome.error(role, last.reason());
                }

                if (attempt == maxAttempts) break;

                Duration wait = Duration.ofMillis(backoff.apply(attempt));
                if (last.retryAfter() != null && last.retryAfter().compareTo(wait) > 0) {
                    wait = last.retryAfter();
                }
                if (wait.toNanos() >= deadline - System.nanoTime()) {
                    log.debug("{} agent: backoff {} exceeds remaining run budget", role.key(), wait);
                    break;
                }
                log.debug("{} agent: attempt {} was {} ({}), retrying in {}",
                        role.key(), attempt, last.kind(), last.reason(), wait);
                try {
                    Thread.sleep(wait.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return AgentOutcome.timeout(role);
                }
            }

            log.warn("{} agent gave up: {}", role.key(), last.reason());
            return last.kind() == AgentCallResult.Kind.TIMEOUT
                    ? AgentOutcome.timeout(role)
                    : AgentOutcome.error(role, last.reason());
        } finally {
            MDC.remove("agent");
        }
    }

    private AgentCallResult callOnce(AgentRole role, String prompt, ApiCredential credential, long timeoutNanos) {
        Future<AgentCallResult> call = agentExecutor.submit(() -> modelInvoker.invoke(role, prompt, credential));
        try {
            AgentCallResult result = call.get(timeoutNanos, TimeUnit.NANOSECONDS);
            return result != null ? result : AgentCallResult.permanent("no result");
        } catch (TimeoutException e) {
            call.cancel(true);
            return AgentCallResult.timeout();
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return AgentCallResult.timeout();
        } catch (ExecutionException e) {
            log.warn("{} agent: model invoker threw {}", role.key(), e.getCause().getClass().getSimpleName());
            return AgentCallResult.permanent(e.getCause().getClass().getSimpleName());
        }
    }

    private AgentOutcome parse(AgentRole role, String text, ReviewDiff diff) {
        Optional<List<Finding>> findings = findingParser.parse(role, text, diff);
        if (findings.isEmpty()) {
            log.warn("{} agent returned an unparseable response", role.key());
            return AgentOutcome.error(role, "unparseable response");
        }
        log.debug("{} agent reported {} finding(s)", role.key(), findings.get().size());
        return AgentOutcome.ok(role, findings.get());
    }
}
