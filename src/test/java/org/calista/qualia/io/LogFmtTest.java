package org.calista.qualia.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogFmtTest {

    @Test
    @DisplayName("should frame aligned key/value lines with equal widths")
    void shouldRenderBox() {
        String box = LogFmt.box("Corpus", b -> b
                .align(6)
                .kv("docs", 3)
                .sep()
                .kvf("score", "%.2f", 1.5)
                .line("done"));

        String[] lines = box.split("\n");
        assertThat(lines).hasSize(8);
        assertThat(lines[0]).startsWith("┌").endsWith("┐");
        assertThat(lines[1]).startsWith("│ Corpus");
        assertThat(lines[3]).startsWith("│ docs  : 3");
        assertThat(lines[4]).matches("│─+│");
        assertThat(lines[5]).startsWith("│ score : 1.50");
        assertThat(lines[6]).startsWith("│ done");
        assertThat(lines[7]).startsWith("└").endsWith("┘");
        for (String l : lines) assertThat(l).hasSameSizeAs(lines[0]);
    }

    @Test
    @DisplayName("should grow past the minimum width for long lines")
    void shouldGrowForLongLines() {
        String longLine = "x".repeat(60);

        String box = LogFmt.box("t", b -> b.line(longLine));

        assertThat(box.split("\n")[3]).contains(longLine);
        assertThat(box.split("\n")[0]).hasSize(60 + 4);
    }
}
