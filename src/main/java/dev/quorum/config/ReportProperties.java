package dev.quorum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "quorum.report")
public record ReportProperties(int maxFindings) {
    public ReportProperties {
        if (maxFindings <= 0) maxFindings = 50;
    }
}
