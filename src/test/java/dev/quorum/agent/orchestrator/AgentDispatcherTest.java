package dev.quorum.agent.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quorum.agent.AgentCallResult;
import dev.quorum.agent.AgentDefinition;
import dev.quorum.agent.AgentRegistry;
import dev.quorum.agent.DispatchResult;
import dev.quorum.agent.FindingParser;
import dev.quorum.config.AiProperties;
import dev.quorum.config.DispatchProperties;
import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.AgentStatus;
import dev.quorum.domain.valueobject.CodeFile;
import dev.quorum.domain.valueobject.ReviewDiff;
import dev.quorum.infrastructure.ai.ModelInvoker;
import dev.quorum.infrastructure.crypto.ApiCredential;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AgentDispatcherTest {

    private static final ReviewDiff DIFF = ReviewDiff.of(List.of(
            new CodeFile("app.py", "python", "@@ -0,0 +1 @@\n+password = 'hunter2'", 1, 0)));

    private static final String ONE_FINDING = """
            [{"file": "app.py", "line_start": 1, "severity": "high",
              "category": "hardcoded-secret", "title": "Hardcoded password"}]
            """;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final AgentRegistry registry = new AgentRegistry();
    private final Map<AgentRole, AtomicInteger> calls = new EnumMap<>(AgentRole.class);
    private final ApiCredential credential = new ApiCredential(42L, "sk-test".toCharArray());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private DispatchProperties properties;

    private AgentDispatcher dispatcher(ModelInvoker invoker, DispatchProperties properties) {
        this.properties = properties;
        for (AgentRole role : AgentRole.values()) calls.put(role, new AtomicInteger());
        ModelInvoker counting = (role, prompt, cred) -> {
            calls.get(role).incrementAndGet();
            return invoker.invoke(role, prompt, cred);
        };
        return new AgentDispatcher(counting, new FindingParser(new ObjectMapper()), properties,
                new AiProperties(null, null, null, null, 0, 0), executor, meterRegistry);
    }

    private DispatchResult dispatch(AgentDispatcher dispatcher, List<AgentDefinition> agents) {
        return dispatcher.run(DIFF, agents, credential, System.nanoTime() + properties.runDeadline().toNanos());
    }

    private static DispatchProperties fast() {
        return new DispatchProperties(Duration.ofMillis(300), Duration.ofSeconds(3), 2, Duration.ofMillis(10));
    }

    private static AgentCallResult hang() {
        try {
            Thread.sleep(10_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return AgentCallResult.ok("[]");
    }

    @Nested
    @DisplayName("Fan-out")
    class FanOut {

        @Test
        @DisplayName("collects findings and an OK status from every agent")
        void allSucceed() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    AgentCallResult.ok(role == AgentRole.SECURITY ? ONE_FINDING : "[]"), fast());

            DispatchResult result = dispatch(dispatcher, registry.all());

            assertThat(result.statuses()).hasSize(4).allSatisfy((r, s) -> assertThat(s).isEqualTo(AgentStatus.OK));
            assertThat(result.findings()).singleElement()
                    .satisfies(f -> assertThat(f.agent()).isEqualTo(AgentRole.SECURITY));
            assertThat(result.allFailed()).isFalse();
            assertThat(meterRegistry.counter("quorum.agent.calls", "agent", "security", "status", "ok").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("a hanging agent times out without holding back the others")
        void oneAgentTimesOut() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    role == AgentRole.PERFORMANCE ? hang() : AgentCallResult.ok("[]"), fast());

            DispatchResult result = dispatch(dispatcher, registry.all());

            assertThat(result.statusOf(AgentRole.PERFORMANCE)).isEqualTo(AgentStatus.TIMEOUT);
            assertThat(result.statusOf(AgentRole.SECURITY)).isEqualTo(AgentStatus.OK);
            assertThat(result.statusOf(AgentRole.LOGIC)).isEqualTo(AgentStatus.OK);
            assertThat(result.statusOf(AgentRole.STYLE)).isEqualTo(AgentStatus.OK);
            assertThat(result.findings()).isEmpty();
            assertThat(result.allFailed()).isFalse();
            assertThat(calls.get(AgentRole.PERFORMANCE).get()).isEqualTo(3);
        }

        @Test
        @DisplayName("rejected key fails every agent once, without retries")
        void allPermanent() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    AgentCallResult.permanent("API key rejected (HTTP 401)"), fast());

            DispatchResult result = dispatch(dispatcher, registry.all());

            assertThat(result.statuses()).allSatisfy((r, s) -> assertThat(s).isEqualTo(AgentStatus.ERROR));
            assertThat(result.allFailed()).isTrue();
            assertThat(calls.values()).allSatisfy(c -> assertThat(c.get()).isEqualTo(1));
        }

        @Test
        @DisplayName("only the given agents are called")
        void onlyEnabledAgents() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) -> AgentCallResult.ok("[]"), fast());

            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.STYLE)));

            assertThat(result.statuses()).containsOnlyKeys(AgentRole.STYLE);
            assertThat(calls.get(AgentRole.SECURITY).get()).isZero();
        }

        @Test
        @DisplayName("no agents means no calls and nothing failed")
        void noAgents() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) -> AgentCallResult.ok("[]"), fast());

            DispatchResult result = dispatch(dispatcher, List.of());

            assertThat(result.statuses()).isEmpty();
            assertThat(result.allFailed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("a transient failure is retried and the later answer is used")
        void transientThenOk() {
            AtomicInteger attempts = new AtomicInteger();
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    attempts.incrementAndGet() == 1
                            ? AgentCallResult.transientFailure("HTTP 503", null)
                            : AgentCallResult.ok(ONE_FINDING), fast());

            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.SECURITY)));

            assertThat(result.statusOf(AgentRole.SECURITY)).isEqualTo(AgentStatus.OK);
            assertThat(result.findings()).hasSize(1);
            assertThat(attempts.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("gives up with ERROR after maxRetries + 1 transient failures")
        void transientExhausted() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    AgentCallResult.transientFailure("HTTP 429", null), fast());

            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.LOGIC)));

            assertThat(result.statusOf(AgentRole.LOGIC)).isEqualTo(AgentStatus.ERROR);
            assertThat(calls.get(AgentRole.LOGIC).get()).isEqualTo(3);
        }

        @Test
        @DisplayName("waits at least the provider's Retry-After before retrying")
        void honoursRetryAfter() {
            AtomicInteger attempts = new AtomicInteger();
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    attempts.incrementAndGet() == 1
                            ? AgentCallResult.transientFailure("HTTP 429", Duration.ofMillis(400))
                            : AgentCallResult.ok("[]"), fast());

            long start = System.nanoTime();
            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.STYLE)));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(result.statusOf(AgentRole.STYLE)).isEqualTo(AgentStatus.OK);
            assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(400));
        }

        @Test
        @DisplayName("a Retry-After shorter than the backoff still waits the backoff")
        void retryAfterBelowBackoff() {
            AtomicInteger attempts = new AtomicInteger();
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    attempts.incrementAndGet() == 1
                            ? AgentCallResult.transientFailure("HTTP 429", Duration.ZERO)
                            : AgentCallResult.ok("[]"),
                    new DispatchProperties(Duration.ofMillis(300), Duration.ofSeconds(3), 2, Duration.ofMillis(250)));

            long start = System.nanoTime();
            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.STYLE)));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(result.statusOf(AgentRole.STYLE)).isEqualTo(AgentStatus.OK);
            assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(250));
        }

        @Test
        @DisplayName("a Retry-After beyond the run budget stops retrying")
        void retryAfterBeyondDeadline() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    AgentCallResult.transientFailure("HTTP 429", Duration.ofMinutes(5)), fast());

            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.STYLE)));

            assertThat(result.statusOf(AgentRole.STYLE)).isEqualTo(AgentStatus.ERROR);
            assertThat(calls.get(AgentRole.STYLE).get()).isEqualTo(1);
        }

        @Test
        @DisplayName("an unparseable answer is an ERROR and is not retried")
        void unparseable() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                    AgentCallResult.ok("I could not find anything wrong."), fast());

            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.LOGIC)));

            assertThat(result.statusOf(AgentRole.LOGIC)).isEqualTo(AgentStatus.ERROR);
            assertThat(calls.get(AgentRole.LOGIC).get()).isEqualTo(1);
        }

        @Test
        @DisplayName("an invoker that throws counts as a permanent failure")
        void invokerThrows() {
            AgentDispatcher dispatcher = dispatcher((role, prompt, cred) -> {
                throw new IllegalStateException("boom");
            }, fast());

            DispatchResult result = dispatch(dispatcher, List.of(registry.definition(AgentRole.LOGIC)));

            assertThat(result.statusOf(AgentRole.LOGIC)).isEqualTo(AgentStatus.ERROR);
            assertThat(calls.get(AgentRole.LOGIC).get()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("the run deadline bounds the whole dispatch")
    void runDeadline() {
        DispatchProperties tight = new DispatchProperties(
                Duration.ofSeconds(30), Duration.ofMillis(500), 2, Duration.ofMillis(10));
        AgentDispatcher dispatcher = dispatcher((role, prompt, cred) -> hang(), tight);

        long start = System.nanoTime();
        DispatchResult result = dispatch(dispatcher, registry.all());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(result.statuses()).hasSize(4).allSatisfy((r, s) -> assertThat(s).isEqualTo(AgentStatus.TIMEOUT));
        assertThat(result.allFailed()).isTrue();
        assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("time already spent before dispatch comes out of the agents' budget")
    void deadlineSetByCaller() {
        AgentDispatcher dispatcher = dispatcher((role, prompt, cred) -> hang(),
                new DispatchProperties(Duration.ofSeconds(30), Duration.ofSeconds(60), 2, Duration.ofMillis(10)));

        long start = System.nanoTime();
        DispatchResult result = dispatcher.run(DIFF, registry.all(), credential, start + Duration.ofMillis(300).toNanos());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(result.statuses()).allSatisfy((r, s) -> assertThat(s).isEqualTo(AgentStatus.TIMEOUT));
        assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("every call sees the run's credential")
    void passesCredential() {
        AgentDispatcher dispatcher = dispatcher((role, prompt, cred) ->
                AgentCallResult.ok("sk-test".equals(cred.reveal()) ? "[]" : "nope"), fast());

        DispatchResult result = dispatch(dispatcher, registry.all());

        assertThat(result.statuses()).allSatisfy((r, s) -> assertThat(s).isEqualTo(AgentStatus.OK));
    }
}
