package it.aw.documentsearch.service;

import it.aw.documentsearch.model.ChunkingParams;

import java.util.ArrayList;
import java.util.List;

/**
 * Divide il testo di una pagina in chunk sovrapposti, paragrafo per paragrafo.
 * <p>
 * Regole:
 * <ul>
 *   <li>il testo viene spezzato sui fine riga; righe vuote o di soli spazi sono scartate</li>
 *   <li>un paragrafo viene aggiunto al chunk corrente se {@code len(chunk) + len(p) + 1 <= maxChars};
 *       altrimenti il chunk viene chiuso e il nuovo chunk parte dagli ultimi
 *       {@code overlap} caratteri di quello chiuso, un '\n' e il paragrafo</li>
 *   <li>la soglia è verificata prima di includere il paragrafo: un paragrafo più lungo
 *       di maxChars finisce comunque in un unico chunk fuori misura</li>
 * </ul>
 * L'overlap è un taglio per numero di caratteri, non per parola: può spezzare
 * una parola a metà. Le lunghezze sono contate in code point.
 * <p>
 * Come spazi si considera l'intero insieme Unicode White_Space, NBSP (U+00A0),
 * U+2007, U+202F e NEL (U+0085) compresi: il testo estratto dai PDF li contiene spesso.
 */
public final class ChunkSplitter {

    private ChunkSplitter() {}

    public static List<String> split(String pageText, ChunkingParams params) {
        return split(pageText, params.chunkSize(), params.overlap());
    }

    /**
     * @param pageText testo della pagina (null equivale a testo vuoto)
     * @param maxChars soglia oltre la quale il chunk corrente viene chiuso
     * @param overlap  caratteri finali del chunk chiuso ripetuti nel successivo
     * @return chunk in ordine di apparizione, vuota se il testo non ha paragrafi
     * @throws IllegalArgumentException se maxChars &lt; 1 o overlap &lt; 0
     */
    public static List<String> split(String pageText, int maxChars, int overlap) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars deve essere >= 1 (ricevuto: " + maxChars + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
        List<String> chunks = new ArrayList<>();
        if (pageText == null || pageText.isEmpty()) {
            return chunks;
        }

        String current = "";
        for (String paragraph : paragraphs(pageText)) {
            int currentLength = codePointLength(current);
            if (currentLength + codePointLength(paragraph) + 1 > maxChars && !current.isEmpty()) {
                chunks.add(current);
                // con overlap 0 il nuovo chunk inizia con "\n" + paragrafo, senza ripetere il chunk chiuso
                current = tail(current, overlap) + "\n" + paragraph;
            } else {
                current = current.isEmpty() ? paragraph : current + "\n" + paragraph;
            }
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    /** Paragrafi non vuoti del testo, già trimmati, nell'ordine originale. */
    static List<String> paragraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            String trimmed = stripWhitespace(line);
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }
        return paragraphs;
    }

    /** Rimuove gli spazi Unicode iniziali e finali; vuota se la riga contiene solo spazi. */
    static String stripWhitespace(String line) {
        int start = 0;
        int end = line.length();
        while (start < end) {
            int cp = line.codePointAt(start);
            if (!isWhitespace(cp)) {
                break;
            }
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = line.codePointBefore(end);
            if (!isWhitespace(cp)) {
                break;
            }
            end -= Character.charCount(cp);
        }
        return line.substring(start, end);
    }

    /**
     * {@link Character#isWhitespace} esclude gli spazi non separabili,
     * {@link Character#isSpaceChar} i caratteri di controllo come tab e NEL.
     */
    static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == 0x85;
    }

    /** Ultimi {@code count} code point di {@code text}; l'intero testo se è più corto. */
    private static String tail(String text, int count) {
        int length = codePointLength(text);
        if (count >= length) {
            return text;
        }
        return text.substring(text.offsetByCodePoints(0, length - count));
    }

    private static int codePointLength(String text) {
        return text.codePointCount(0, text.length());
    }
}
