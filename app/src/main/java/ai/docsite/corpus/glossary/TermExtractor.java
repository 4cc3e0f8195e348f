package ai.docsite.corpus.glossary;

import java.util.List;

/**
 * Extracts candidate terminology tokens from one side of a translation unit.
 */
public interface TermExtractor {

    /**
     * @return distinct candidates in order of first appearance
     */
    List<String> extract(String text);
}
