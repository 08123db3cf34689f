package it.aw.documentsearch.service;

import it.aw.documentsearch.model.ChunkingParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChunkSplitter")
class ChunkSplitterTest {

    @Test
    @DisplayName("tre paragrafi da 100 con 250/50 producono due chunk")
    void splitsThreeParagraphsIntoTwoChunks() {
        String a = "A".repeat(100);
        String b = "B".repeat(100);
        String c = "C".repeat(100);

        List<String> chunks = ChunkSplitter.split(a + "\n" + b + "\n" + c, 250, 50);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).isEqualTo(a + "\n" + b);
        assertThat(chunks.get(0).length()).isLessThanOrEqualTo(251);
        assertThat(chunks.get(1)).isEqualTo("B".repeat(50) + "\n" + c);
    }

    @Test
    void emptyTextYieldsNoChunks() {
        assertThat(ChunkSplitter.split("", 1500, 200)).isEmpty();
        assertThat(ChunkSplitter.split(null, 1500, 200)).isEmpty();
        assertThat(ChunkSplitter.split(" \n\t\n   \n", 1500, 200)).isEmpty();
    }

    @Test
    void dropsBlankLinesAndTrimsParagraphs() {
        List<String> chunks = ChunkSplitter.split("  \n\n  foo  \n\t\nbar\r\n", 1500, 200);

        assertThat(chunks).containsExactly("foo\nbar");
    }

    @Test
    @DisplayName("un paragrafo più lungo di maxChars resta un unico chunk")
    void oversizedParagraphIsEmittedWhole() {
        String longParagraph = "x".repeat(50);

        assertThat(ChunkSplitter.split(longParagraph, 10, 2)).containsExactly(longParagraph);
    }

    @Test
    void oversizedParagraphAfterShortOneStartsNewChunkWithOverlap() {
        String longParagraph = "x".repeat(50);

        List<String> chunks = ChunkSplitter.split("ab\n" + longParagraph, 10, 2);

        assertThat(chunks).containsExactly("ab", "ab\n" + longParagraph);
    }

    @Test
    @DisplayName("l'overlap è un taglio per caratteri e può spezzare le parole")
    void overlapCutsMidWord() {
        List<String> chunks = ChunkSplitter.split("hello world\nsecond", 12, 3);

        assertThat(chunks).containsExactly("hello world", "rld\nsecond");
    }

    @Test
    void zeroOverlapStartsNextChunkWithNewline() {
        List<String> chunks = ChunkSplitter.split("aaaa\nbbbb", 6, 0);

        assertThat(chunks).containsExactly("aaaa", "\nbbbb");
    }

    @Test
    @DisplayName("righe di soli spazi non separabili vengono scartate")
    void dropsLinesOfNonBreakingSpaces() {
        assertThat(ChunkSplitter.split("foo\n\u00A0\u00A0\nbar", 1500, 200)).containsExactly("foo\nbar");
        assertThat(ChunkSplitter.split("\u2007\n\u202F\u0085\n\u3000", 1500, 200)).isEmpty();
    }

    @Test
    void stripsUnicodeWhitespaceAroundParagraphs() {
        assertThat(ChunkSplitter.split("foo\u00A0", 1500, 200)).containsExactly("foo");
        assertThat(ChunkSplitter.split("\u00A0\tfoo bar\u202F\u0085", 1500, 200)).containsExactly("foo bar");
    }

    @Test
    @DisplayName("gli NBSP finali non contano nella lunghezza del chunk")
    void trailingNonBreakingSpacesDoNotAffectBoundaries() {
        List<String> chunks = ChunkSplitter.split("aaaa\u00A0\u00A0\u00A0\nbb", 7, 2);

        assertThat(chunks).containsExactly("aaaa\nbb");
    }

    @Test
    void keepsInnerNonBreakingSpaces() {
        assertThat(ChunkSplitter.split("10\u00A0mA", 1500, 200)).containsExactly("10\u00A0mA");
    }

    @Test
    void rejectsInvalidSizes() {
        assertThatThrownBy(() -> ChunkSplitter.split("text", 10, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overlap");
        assertThatThrownBy(() -> ChunkSplitter.split("text", 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxChars");
    }

    @Test
    void overlapNeverSplitsSurrogatePairs() {
        String emoji = "😀";

        List<String> chunks = ChunkSplitter.split(emoji.repeat(3) + "\nx", 4, 2);

        assertThat(chunks).containsExactly(emoji.repeat(3), emoji.repeat(2) + "\nx");
    }

    @Test
    void paramsOverloadUsesChunkSizeAndOverlap() {
        String text = "A".repeat(100) + "\n" + "B".repeat(100) + "\n" + "C".repeat(100);

        assertThat(ChunkSplitter.split(text, new ChunkingParams(250, 50)))
                .isEqualTo(ChunkSplitter.split(text, 250, 50));
    }

    @Test
    @DisplayName("ri-dividere i paragrafi uniti da newline dà gli stessi chunk")
    void splittingIsDeterministicOverNormalizedParagraphs() {
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            String text = randomPage(random);
            int maxChars = 20 + random.nextInt(200);
            int overlap = random.nextInt(maxChars);

            List<String> original = ChunkSplitter.split(text, maxChars, overlap);
            String normalized = String.join("\n", ChunkSplitter.paragraphs(text));

            assertThat(ChunkSplitter.split(normalized, maxChars, overlap)).isEqualTo(original);
        }
    }

    @Test
    @DisplayName("ogni paragrafo non vuoto compare in almeno un chunk")
    void everyParagraphAppearsInSomeChunk() {
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            String text = randomPage(random);
            int maxChars = 20 + random.nextInt(200);
            int overlap = random.nextInt(maxChars);

            List<String> chunks = ChunkSplitter.split(text, maxChars, overlap);

            for (String paragraph : ChunkSplitter.paragraphs(text)) {
                assertThat(chunks).anySatisfy(chunk -> assertThat(chunk).contains(paragraph));
            }
        }
    }

    private static String randomPage(Random random) {
        List<String> lines = new ArrayList<>();
        int lineCount = random.nextInt(30);
        for (int l = 0; l < lineCount; l++) {
            int kind = random.nextInt(5);
            if (kind == 0) {
                lines.add("");
            } else if (kind == 1) {
                lines.add("   \t ");
            } else {
                StringBuilder sb = new StringBuilder();
                if (random.nextBoolean()) sb.append("  ");
                int words = 1 + random.nextInt(kind * 8);
                for (int w = 0; w < words; w++) {
                    if (w > 0) sb.append(' ');
                    int len = 1 + random.nextInt(10);
                    for (int c = 0; c < len; c++) sb.append((char) ('a' + random.nextInt(26)));
                }
                lines.add(sb.toString());
            }
        }
        return String.join("\n", lines);
    }
}
