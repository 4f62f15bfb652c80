package dev.quorum.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.Severity;
import dev.quorum.domain.valueobject.Finding;
import dev.quorum.domain.valueobject.ReviewDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model output into findings.
 *
 * <p>Accepts a bare JSON array or an object with a {@code findings} array, optionally
 * fenced in markdown or surrounded by prose. Items that cannot become a finding are
 * dropped one by one; only output with no recognisable structure at all is reported
 * as unparseable.
 */
@Component
public class FindingParser {

    private static final Logger log = LoggerFactory.getLogger(FindingParser.class);
    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z]*\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public FindingParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the findings, or empty when the response has no parseable structure
     */
    public Optional<List<Finding>> parse(AgentRole role, String response, ReviewDiff diff) {
        Optional<JsonNode> items = locateItems(response);
        if (items.isEmpty()) {
            return Optional.empty();
        }
        String onlyFile = diff != null && diff.fileCount() == 1 ? diff.files().get(0).path() : null;

        List<Finding> findings = new ArrayList<>();
        int dropped = 0;
        for (JsonNode item : items.get()) {
            Optional<Finding> finding = toFinding(role, item, onlyFile);
            if (finding.isPresent()) {
                findings.add(finding.get());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("{} agent: dropped {} malformed item(s)", role.key(), dropped);
        }
        return Optional.of(findings);
    }

    private Optional<JsonNode> locateItems(String response) {
        if (response == null || response.isBlank()) return Optional.empty();
        String trimmed = response.trim();
        Matcher fence = FENCE.matcher(trimmed);
        String body = fence.find() ? fence.group(1).trim() : trimmed;

        JsonNode root = read(body)
                .or(() -> read(slice(body, '[', ']')))
                .or(() -> read(slice(body, '{', '}')))
                .orElse(null);
        if (root == null) return Optional.empty();
        if (root.isArray()) return Optional.of(root);
        if (root.isObject() && root.path("findings").isArray()) return Optional.of(root.get("findings"));
        return Optional.empty();
    }

    private Optional<JsonNode> read(String candidate) {
        if (candidate == null) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static String slice(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        return start >= 0 && end > start ? text.substring(start, end + 1) : null;
    }

    private Optional<Finding> toFinding(AgentRole role, JsonNode item, String onlyFile) {
        if (!item.isObject()) return Optional.empty();

        Optional<Severity> severity = Severity.parse(text(item, "severity"));
        if (severity.isEmpty()) return Optional.empty();

        String file = firstNonBlank(text(item, "file"), text(item, "file_path"), text(item, "path"), onlyFile);
        if (file == null) return Optional.empty();

        int lineStart = line(item, "line_start").orElseGet(() -> line(item, "line").orElse(1));
        int lineEnd = line(item, "line_end").orElse(lineStart);

        String title = text(item, "title");
        String description = text(item, "description");
        String message = firstNonBlank(text(item, "message"), join(title, description));
        if (message == null) return Optional.empty();

        try {
            return Optional.of(new Finding(role, severity.get(), file, lineStart, lineEnd,
                    text(item, "category"), message, text(item, "suggestion")));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static Optional<Integer> line(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) return Optional.empty();
        if (node.canConvertToInt()) return Optional.of(node.asInt());
        if (node.isTextual()) {
            try {
                return Optional.of(Integer.parseInt(node.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String join(String title, String description) {
        if (title == null) return description;
        if (description == null) return title;
        return title + ": " + description;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
