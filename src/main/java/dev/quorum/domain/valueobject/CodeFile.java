package dev.quorum.domain.valueobject;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable representation of a file in a PR diff.
 */
public record CodeFile(
        String path,
        String language,
        String patch,
        int additions,
        int deletions
) {
    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry(".py", "python"), Map.entry(".js", "javascript"), Map.entry(".ts", "typescript"),
            Map.entry(".jsx", "javascript"), Map.entry(".tsx", "typescript"), Map.entry(".go", "go"),
            Map.entry(".rs", "rust"), Map.entry(".java", "java"), Map.entry(".rb", "ruby"),
            Map.entry(".php", "php"), Map.entry(".c", "c"), Map.entry(".cpp", "cpp"),
            Map.entry(".cs", "csharp"), Map.entry(".swift", "swift"), Map.entry(".kt", "kotlin"));

    private static final List<String> SKIP_PATTERNS = List.of(
            "package-lock.json", "yarn.lock", "poetry.lock", "Pipfile.lock",
            ".min.js", ".min.css", "vendor/", "node_modules/", "__pycache__/", ".git/");

    public static String detectLanguage(String path) {
        if (path == null) return "unknown";
        String lower = path.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot < 0) return "unknown";
        return LANGUAGES.getOrDefault(lower.substring(dot), "unknown");
    }

    /**
     * Source files with a patch, outside lockfiles and vendored or generated trees.
     */
    public boolean isReviewable() {
        if (path == null || patch == null || patch.isBlank()) return false;
        for (String pattern : SKIP_PATTERNS) {
            if (path.contains(pattern)) return false;
        }
        return !"unknown".equals(language);
    }
}
