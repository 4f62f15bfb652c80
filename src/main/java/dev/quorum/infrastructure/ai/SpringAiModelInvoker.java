package dev.quorum.infrastructure.ai;

import dev.quorum.agent.AgentCallResult;
import dev.quorum.config.AiProperties;
import dev.quorum.config.DispatchProperties;
import dev.quorum.domain.enums.AgentRole;
import dev.quorum.infrastructure.crypto.ApiCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Calls an OpenAI-compatible chat endpoint through Spring AI.
 *
 * <p>The chat model is built per call because the API key belongs to the
 * installation, not the process. Spring AI's own retry is switched off: the
 * dispatcher owns retry and needs the raw classification.
 *
 * <p>Classification: 408, 429 and 5xx responses and I/O failures are transient;
 * 401/403 and every other failure are permanent.
 */
@Component
public class SpringAiModelInvoker implements ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelInvoker.class);

    private final AiProperties aiProperties;
    private final Duration callTimeout;
    private final Clock clock;

    public SpringAiModelInvoker(AiProperties aiProperties, DispatchProperties dispatchProperties) {
        this(aiProperties, dispatchProperties, Clock.systemUTC());
    }

    SpringAiModelInvoker(AiProperties aiProperties, DispatchProperties dispatchProperties, Clock clock) {
        this.aiProperties = aiProperties;
        this.callTimeout = dispatchProperties.callTimeout();
        this.clock = clock;
    }

    @Override
    public AgentCallResult invoke(AgentRole role, String prompt, ApiCredential credential) {
        try {
            OpenAiChatModel chatModel = chatModel(credential.reveal());
            ChatResponse response = chatModel.call(new Prompt(prompt));
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                return AgentCallResult.ok("");
            }
            return AgentCallResult.ok(response.getResult().getOutput().getText());
        } catch (RestClientResponseException e) {
            return classifyHttp(role, e);
        } catch (RestClientException e) {
            if (causedByIo(e)) {
                log.debug("{} agent: network failure: {}", role.key(), e.getMessage());
                return AgentCallResult.transientFailure("network failure", null);
            }
            log.warn("{} agent: model client failure: {}", role.key(), e.getClass().getSimpleName());
            return AgentCallResult.permanent("client failure: " + e.getClass().getSimpleName());
        } catch (TransientAiException e) {
            return AgentCallResult.transientFailure("transient model failure", null);
        } catch (NonTransientAiException e) {
            return AgentCallResult.permanent("model request rejected");
        } catch (IllegalStateException e) {
            return AgentCallResult.permanent(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} agent: unexpected model client failure: {}", role.key(), e.getClass().getSimpleName());
            return AgentCallResult.permanent("unexpected failure: " + e.getClass().getSimpleName());
        }
    }

    private AgentCallResult classifyHttp(AgentRole role, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        if (status == 429 || status == 408 || status >= 500) {
            HttpHeaders headers = e.getResponseHeaders();
            Duration hint = headers == null ? null
                    : RetryAfter.parse(headers.getFirst(HttpHeaders.RETRY_AFTER), clock).orElse(null);
            log.debug("{} agent: transient HTTP {} (retry-after {})", role.key(), status, hint);
            return AgentCallResult.transientFailure("HTTP " + status, hint);
        }
        if (status == 401 || status == 403) {
            return AgentCallResult.permanent("API key rejected (HTTP " + status + ")");
        }
        return AgentCallResult.permanent("HTTP " + status);
    }

    // a reset mid-body arrives as a plain RestClientException wrapping the IOException
    private static boolean causedByIo(Throwable e) {
        for (Throwable t = e; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof IOException) return true;
        }
        return false;
    }

    private OpenAiChatModel chatModel(String apiKey) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(callTimeout);
        requestFactory.setReadTimeout(callTimeout);

        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(aiProperties.baseUrl())
                .completionsPath(aiProperties.completionsPath())
                .apiKey(apiKey)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .responseErrorHandler(new DefaultResponseErrorHandler())
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(aiProperties.model())
                .temperature(aiProperties.temperature())
                .maxTokens(aiProperties.maxOutputTokens())
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
