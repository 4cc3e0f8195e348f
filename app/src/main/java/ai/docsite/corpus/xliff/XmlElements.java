package ai.docsite.corpus.xliff;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Namespace-agnostic DOM lookups by local element name.
 */
final class XmlElements {

    private XmlElements() {
    }

    static String localName(Node node) {
        String localName = node.getLocalName();
        if (localName != null) {
            return localName;
        }
        String nodeName = node.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(child))) {
                result.add((Element) child);
            }
        }
        return result;
    }

    static List<Element> descendants(Element parent, String name) {
        NodeList nodes = parent.getElementsByTagNameNS("*", name);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    static Optional<Element> firstChild(Element parent, String name) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(child))) {
                return Optional.of((Element) child);
            }
        }
        return Optional.empty();
    }

    static Optional<Element> firstChildOrDescendant(Element parent, String name) {
        Optional<Element> direct = firstChild(parent, name);
        if (direct.isPresent()) {
            return direct;
        }
        NodeList nodes = parent.getElementsByTagNameNS("*", name);
        return nodes.getLength() == 0 ? Optional.empty() : Optional.of((Element) nodes.item(0));
    }

    /**
     * Concatenated descendant text in document order; inline tags contribute only their text.
     */
    static String text(Element element) {
        String content = element.getTextContent();
        return content == null ? "" : content;
    }
}
