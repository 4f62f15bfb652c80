package dev.quorum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Model endpoint config. Any OpenAI-compatible chat endpoint works; the default
 * is Gemini's compatibility layer so installations can bring a Gemini key.
 */
@ConfigurationProperties(prefix = "quorum.ai")
public record AiProperties(String baseUrl, String completionsPath, String model,
                           Double temperature, int maxOutputTokens, int maxDiffChars) {
    public AiProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai";
        if (completionsPath == null || completionsPath.isBlank()) completionsPath = "/chat/completions";
        if (model == null || model.isBlank()) model = "gemini-2.0-flash";
        if (temperature == null) temperature = 0.2;
        if (maxOutputTokens <= 0) maxOutputTokens = 2048;
        if (maxDiffChars <= 0) maxDiffChars = 60_000;
    }
}
