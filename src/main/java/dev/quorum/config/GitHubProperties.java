package dev.quorum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "quorum.github")
public record GitHubProperties(long appId, String privateKey, String webhookSecret, String apiUrl) {
    public GitHubProperties {
        if (apiUrl == null || apiUrl.isBlank()) apiUrl = "https://api.github.com";
    }
}
