package it.aw.regmetrics.service;

import it.aw.regmetrics.model.MetricsRecord;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metriche su un blocco di testo: numero di parole, checksum SHA-256
 * e complessità (Flesch-Kincaid grade level).
 * <p>
 * Word count e checksum operano sempre sulla stessa stringa, senza normalizzazioni.
 */
public class MetricsCalculator {

    // whitespace Unicode (NBSP, thin space, ...) più i separatori di controllo 0x1C-0x1F
    private static final Pattern WHITESPACE     = Pattern.compile("[\\s\\x1c-\\x1f]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_SPACE     = Pattern.compile("^[\\s\\x1c-\\x1f]+|[\\s\\x1c-\\x1f]+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SENTENCE_END   = Pattern.compile("[.!?]+(?=\\s|$)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_WORD_CHARS = Pattern.compile("[^\\p{L}\\p{N}']");
    private static final Pattern VOWEL_GROUP    = Pattern.compile("[aeiouy]+");
    private static final Pattern HAS_ALNUM      = Pattern.compile("[\\p{L}\\p{N}]");

    private MetricsCalculator() {}

    public static MetricsRecord compute(String text) {
        return new MetricsRecord(wordCount(text), checksum(text), complexity(text));
    }

    /** Numero di token separati da whitespace. */
    public static long wordCount(String text) {
        String trimmed = strip(text);
        if (trimmed.isEmpty()) return 0;
        return WHITESPACE.split(trimmed).length;
    }

    /** SHA-256 esadecimale dei byte UTF-8 del testo esatto. */
    public static String checksum(String text) {
        return DigestUtils.sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Flesch-Kincaid grade level:
     * {@code 0.39 * parole/frasi + 11.8 * sillabe/parole - 15.59}, arrotondato a un decimale.
     *
     * @return null se nel testo non ci sono parole (formula non applicabile)
     */
    public static Double complexity(String text) {
        String trimmed = strip(text);
        if (trimmed.isEmpty()) return null;

        long words = 0;
        long syllables = 0;
        for (String token : WHITESPACE.split(trimmed)) {
            String word = NON_WORD_CHARS.matcher(token).replaceAll("");
            if (word.isEmpty()) continue;
            words++;
            syllables += syllables(word);
        }
        if (words == 0) return null;

        long sentences = Math.max(1, sentenceCount(text));
        double grade = 0.39 * ((double) words / sentences)
                + 11.8 * ((double) syllables / words)
                - 15.59;
        return Math.round(grade * 10.0) / 10.0;
    }

    /**
     * Rimuove il whitespace iniziale e finale con la stessa classe di caratteri
     * usata per separare le parole. Null diventa "".
     */
    static String strip(String text) {
        if (text == null) return "";
        return EDGE_SPACE.matcher(text).replaceAll("");
    }

    /** Frasi terminate da punteggiatura che contengono almeno un carattere alfanumerico. */
    static long sentenceCount(String text) {
        long count = 0;
        for (String sentence : SENTENCE_END.split(text)) {
            if (HAS_ALNUM.matcher(sentence).find()) count++;
        }
        return count;
    }

    /**
     * Stima delle sillabe di una parola inglese: gruppi di vocali,
     * meno la "e" muta finale, minimo uno.
     */
    static int syllables(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (!HAS_ALNUM.matcher(lower).find()) return 0;
        Matcher m = VOWEL_GROUP.matcher(lower);
        int groups = 0;
        while (m.find()) groups++;
        if (groups > 1 && lower.endsWith("e") && !lower.endsWith("le")) {
            groups--;
        }
        return Math.max(1, groups);
    }
}
