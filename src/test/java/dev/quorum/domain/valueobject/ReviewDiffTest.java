package dev.quorum.domain.valueobject;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewDiffTest {

    private static CodeFile file(String path, String patch) {
        return new CodeFile(path, CodeFile.detectLanguage(path), patch, 1, 0);
    }

    @Test
    @DisplayName("keeps source files with a patch, drops lockfiles, vendored code and unknown types")
    void filtersReviewableFiles() {
        ReviewDiff diff = ReviewDiff.of(List.of(
                file("src/app.py", "+x = 1"),
                file("package-lock.json", "+{}"),
                file("web/vendor/lib.js", "+var a"),
                file("static/app.min.js", "+var a"),
                file("README.md", "+docs"),
                file("src/Main.java", null),
                file("src/Main.kt", "+fun main() {}")));

        assertThat(diff.files()).extracting(CodeFile::path).containsExactly("src/app.py", "src/Main.kt");
        assertThat(diff.fileCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("language detection is case-insensitive and unknown without an extension")
    void detectsLanguage() {
        assertThat(CodeFile.detectLanguage("A.JAVA")).isEqualTo("java");
        assertThat(CodeFile.detectLanguage("x.tsx")).isEqualTo("typescript");
        assertThat(CodeFile.detectLanguage("Makefile")).isEqualTo("unknown");
    }

    @Test
    @DisplayName("prompt text fences each file with its language")
    void rendersFencedBlocks() {
        ReviewDiff diff = ReviewDiff.of(List.of(file("app.py", "+password = 'x'")));

        assertThat(diff.toPromptText(10_000))
                .contains("### app.py")
                .contains("```python\n+password = 'x'\n```");
    }

    @Test
    @DisplayName("truncates at a file boundary and says how many files were left out")
    void truncatesAtFileBoundary() {
        String patch = "+" + "a".repeat(200);
        ReviewDiff diff = ReviewDiff.of(List.of(file("a.py", patch), file("b.py", patch), file("c.py", patch)));

        String text = diff.toPromptText(300);

        assertThat(text).contains("### a.py").doesNotContain("### b.py");
        assertThat(text).contains("[diff truncated: 2 more file(s) not shown]");
    }

    @Test
    @DisplayName("empty when nothing is reviewable")
    void emptyDiff() {
        assertThat(ReviewDiff.of(List.of(file("yarn.lock", "+x"))).isEmpty()).isTrue();
    }
}
