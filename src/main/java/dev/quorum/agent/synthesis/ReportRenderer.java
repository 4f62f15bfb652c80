package dev.quorum.agent.synthesis;

import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.ReviewVerdict;
import dev.quorum.domain.enums.Severity;
import dev.quorum.domain.valueobject.Finding;
import dev.quorum.domain.valueobject.PullRequestRef;
import dev.quorum.domain.valueobject.SynthesizedReport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Markdown for everything posted back to the pull request.
 */
@Component
public class ReportRenderer {

    private static final String FOOTER = "---\n*Reviewed by Quorum: security, logic, performance and style agents*";

    public String render(PullRequestRef pr, SynthesizedReport report) {
        StringBuilder sb = header(pr);
        if (report.isEmpty()) {
            sb.append("No issues found. :white_check_mark:\n\n");
            return sb.append(FOOTER).toString();
        }

        sb.append("Found %d issue(s).\n\n".formatted(report.issuesFound()));
        for (AgentRole role : AgentRole.values()) {
            List<Finding> section = report.findingsBy(role);
            if (section.isEmpty()) continue;
            sb.append("### ").append(title(role)).append("\n\n");
            for (Finding f : section) {
                sb.append("- **%s** · `%s:%s` · [%s] %s\n".formatted(
                        f.severity().label(), f.file(), f.lineDisplay(), f.category(), f.message()));
                if (f.suggestion() != null) {
                    sb.append("  - Suggestion: ").append(f.suggestion()).append('\n');
                }
            }
            sb.append('\n');
        }
        if (report.omitted() > 0) {
            sb.append("_...and %d more issue(s) not shown._\n\n".formatted(report.omitted()));
        }
        return sb.append(FOOTER).toString();
    }

    public String renderAllAgentsFailed(PullRequestRef pr) {
        return header(pr)
                .append("None of the review agents could complete their analysis of this change, ")
                .append("so no findings are reported. This usually means the model provider rejected ")
                .append("the configured API key or was unavailable. The review will run again on the next push.\n\n")
                .append(FOOTER)
                .toString();
    }

    public String renderConfigurationProblem(PullRequestRef pr, String userMessage) {
        return header(pr)
                .append("This pull request was not reviewed. ")
                .append(userMessage)
                .append("\n\n")
                .append(FOOTER)
                .toString();
    }

    /**
     * APPROVE only when the installation opted in and nothing medium or worse was found.
     */
    public ReviewVerdict verdict(SynthesizedReport report, boolean autoApprove) {
        if (!autoApprove) return ReviewVerdict.COMMENT;
        boolean blocking = report.findings().stream().anyMatch(f -> f.severity().isAtLeast(Severity.MEDIUM));
        return blocking ? ReviewVerdict.COMMENT : ReviewVerdict.APPROVE;
    }

    private static StringBuilder header(PullRequestRef pr) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Quorum Code Review\n\n");
        sb.append("**Repository**: %s | **PR**: #%d | **Commit**: `%s`\n\n"
                .formatted(pr.repoFullName(), pr.prNumber(), pr.shortSha()));
        return sb;
    }

    private static String title(AgentRole role) {
        return switch (role) {
            case SECURITY -> "Security";
            case LOGIC -> "Logic";
            case PERFORMANCE -> "Performance";
            case STYLE -> "Style";
        };
    }
}
