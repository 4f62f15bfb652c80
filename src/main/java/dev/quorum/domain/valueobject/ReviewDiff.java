package dev.quorum.domain.valueobject;

import java.util.List;

/**
 * The reviewable slice of a pull request: what every agent sees.
 */
public record ReviewDiff(List<CodeFile> files) {

    private static final String TRUNCATION_MARKER = "\n[diff truncated: %d more file(s) not shown]\n";

    public ReviewDiff {
        files = List.copyOf(files);
    }

    public static ReviewDiff of(List<CodeFile> changedFiles) {
        return new ReviewDiff(changedFiles.stream().filter(CodeFile::isReviewable).toList());
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int fileCount() {
        return files.size();
    }

    /**
     * Renders the files as fenced blocks, stopping at a file boundary once
     * maxChars would be exceeded. The first file is always included, cut if needed.
     */
    public String toPromptText(int maxChars) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < files.size(); i++) {
            CodeFile f = files.get(i);
            String block = "### %s\n```%s\n%s\n```\n\n".formatted(f.path(), f.language(), f.patch());
            if (sb.length() + block.length() > maxChars) {
                if (i == 0) sb.append(block, 0, Math.max(0, maxChars));
                sb.append(TRUNCATION_MARKER.formatted(files.size() - (i == 0 ? 1 : i)));
                break;
            }
            sb.append(block);
        }
        return sb.toString();
    }
}
