package ai.docsite.corpus.segment;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Sentence segmentation backed by the JDK's locale-sensitive {@link BreakIterator}.
 * Whitespace-only spans are dropped.
 */
public class BreakIteratorSentenceSegmenter implements SentenceSegmenter {

    private final Locale locale;

    public BreakIteratorSentenceSegmenter(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale");
    }

    @Override
    public List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        BreakIterator iterator = BreakIterator.getSentenceInstance(locale);
        iterator.setText(text);
        List<String> sentences = new ArrayList<>();
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            String sentence = text.substring(start, end);
            if (!sentence.isBlank()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }
}
