package villagecompute.talentqueue.jobs;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cheap text metrics attached to every analysis result, independent of the model's answer.
 *
 * @param wordCount
 *            number of whitespace separated words
 * @param characterCount
 *            number of characters
 * @param estimatedReadingTime
 *            minutes at {@value #WORDS_PER_MINUTE} words per minute, rounded up
 * @param complexity
 *            1 (simple) to 10 (dense), from average word and sentence length
 * @param keyPhrases
 *            up to {@value #MAX_KEY_PHRASES} most frequent words longer than three characters
 */
public record TextStatistics(int wordCount, int characterCount, int estimatedReadingTime, int complexity,
        List<String> keyPhrases) {

    static final int WORDS_PER_MINUTE = 200;

    static final int MAX_KEY_PHRASES = 10;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]");

    public static TextStatistics of(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return new TextStatistics(0, 0, 0, 1, List.of());
        }

        String[] words = WHITESPACE.split(trimmed);
        int wordCount = words.length;
        int readingTime = (wordCount + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE;

        Map<String, Integer> frequencies = new HashMap<>();
        long letters = 0;
        for (String word : words) {
            String normalized = NON_WORD.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
            letters += normalized.length();
            if (normalized.length() > 3) {
                frequencies.merge(normalized, 1, Integer::sum);
            }
        }

        long sentences = SENTENCE_END.splitAsStream(trimmed).filter(s -> !s.isBlank()).count();
        double avgWordLength = (double) letters / wordCount;
        double avgSentenceLength = (double) wordCount / Math.max(1, sentences);
        int complexity = (int) Math.round(avgWordLength / 2 + avgSentenceLength / 5);
        complexity = Math.max(1, Math.min(10, complexity));

        List<String> keyPhrases = frequencies.entrySet().stream()
                .sorted(Map.Entry.<String, Integer> comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_KEY_PHRASES).map(Map.Entry::getKey).toList();

        return new TextStatistics(wordCount, trimmed.length(), readingTime, complexity, keyPhrases);
    }
}
