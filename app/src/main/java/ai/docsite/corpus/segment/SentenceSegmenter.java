package ai.docsite.corpus.segment;

import java.util.List;

/**
 * Splits raw text into an ordered sequence of sentences.
 */
@FunctionalInterface
public interface SentenceSegmenter {

    /**
     * @return sentences in order, each with its original whitespace
     */
    List<String> split(String text);
}
