package ai.docsite.corpus.xliff;

import ai.docsite.corpus.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Collects the text of every {@code target} element in document order, whatever the XLIFF
 * version or namespace. Surrounding whitespace is stripped; interior newlines are kept.
 */
public class TargetTextExtractor {

    public List<String> extract(Document document, boolean skipBlank) {
        NodeList targets = document.getElementsByTagNameNS("*", DocumentShape.TARGET);
        List<String> texts = new ArrayList<>(targets.getLength());
        for (int i = 0; i < targets.getLength(); i++) {
            String text = TextNormalizer.trim(XmlElements.text((Element) targets.item(i)));
            if (skipBlank && text.isEmpty()) {
                continue;
            }
            texts.add(text);
        }
        return texts;
    }
}
