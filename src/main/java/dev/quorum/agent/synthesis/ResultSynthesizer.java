package dev.quorum.agent.synthesis;

import dev.quorum.config.ReportProperties;
import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.valueobject.Finding;
import dev.quorum.domain.valueobject.SynthesizedReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merges all agents' findings into one report.
 *
 * <p>Two findings are duplicates when they share file and category and their line
 * ranges overlap. Findings are visited strongest first (severity, then agent
 * priority, then content) and each one is kept only if it duplicates nothing
 * already kept. Since the visiting order is total, the result does not depend on
 * input order, and a kept set is a fixed point of a second pass.
 *
 * <p>Report order: severity desc, file, line, agent name, then remaining fields.
 */
@Component
public class ResultSynthesizer {

    static final Comparator<Finding> STRENGTH = Comparator
            .comparing(Finding::severity)
            .thenComparing(Finding::agent)
            .thenComparing(ResultSynthesizer::byContent);

    static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::severity)
            .thenComparing(Finding::file)
            .thenComparingInt(Finding::lineStart)
            .thenComparing(f -> f.agent().key())
            .thenComparing(ResultSynthesizer::byContent);

    private final int maxFindings;

    public ResultSynthesizer(ReportProperties reportProperties) {
        this.maxFindings = reportProperties.maxFindings();
    }

    public SynthesizedReport synthesize(Collection<Finding> findings) {
        List<Finding> kept = deduplicate(findings);
        kept.sort(REPORT_ORDER);

        Map<AgentRole, Integer> issuesByType = new EnumMap<>(AgentRole.class);
        for (AgentRole role : AgentRole.values()) {
            issuesByType.put(role, 0);
        }
        kept.forEach(f -> issuesByType.merge(f.agent(), 1, Integer::sum));

        int omitted = Math.max(0, kept.size() - maxFindings);
        List<Finding> retained = omitted > 0 ? kept.subList(0, maxFindings) : kept;
        return new SynthesizedReport(retained, issuesByType, omitted);
    }

    private static List<Finding> deduplicate(Collection<Finding> findings) {
        List<Finding> candidates = new ArrayList<>(findings);
        candidates.sort(STRENGTH);
        List<Finding> kept = new ArrayList<>();
        for (Finding candidate : candidates) {
            boolean duplicate = false;
            for (Finding k : kept) {
                if (k.duplicates(candidate)) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) kept.add(candidate);
        }
        return kept;
    }

    private static int byContent(Finding a, Finding b) {
        int c = a.file().compareTo(b.file());
        if (c != 0) return c;
        c = Integer.compare(a.lineStart(), b.lineStart());
        if (c != 0) return c;
        c = Integer.compare(a.lineEnd(), b.lineEnd());
        if (c != 0) return c;
        c = a.category().compareTo(b.category());
        if (c != 0) return c;
        c = a.message().compareTo(b.message());
        if (c != 0) return c;
        return Comparator.nullsFirst(Comparator.<String>naturalOrder()).compare(a.suggestion(), b.suggestion());
    }
}
