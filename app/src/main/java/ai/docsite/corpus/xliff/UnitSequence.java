package ai.docsite.corpus.xliff;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Lazy, restartable view of the translation units of a parsed document.
 *
 * <p>Each call to {@link #iterator()} walks the tree again, so the sequence can be read more than
 * once. DOM node lists are not thread-safe: iterations must not run concurrently, and the document
 * must not be modified while it is being iterated. Copy the units into a list before sharing them
 * across threads.
 */
public final class UnitSequence implements Iterable<TranslationUnit> {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnitSequence.class);

    private final Document document;
    private final DocumentShape shape;

    UnitSequence(Document document, DocumentShape shape) {
        this.document = Objects.requireNonNull(document, "document");
        this.shape = Objects.requireNonNull(shape, "shape");
    }

    public DocumentShape shape() {
        return shape;
    }

    @Override
    public Iterator<TranslationUnit> iterator() {
        return switch (shape) {
            case FLAT -> new FlatIterator(document.getElementsByTagNameNS("*", DocumentShape.TRANS_UNIT));
            case SEGMENTED -> new SegmentedIterator(document.getElementsByTagNameNS("*", DocumentShape.UNIT));
        };
    }

    public Stream<TranslationUnit> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    public List<TranslationUnit> toList() {
        List<TranslationUnit> units = new ArrayList<>();
        forEach(units::add);
        return List.copyOf(units);
    }

    static Optional<TranslationUnit> fromPair(String id, Element container) {
        Optional<Element> source = XmlElements.firstChild(container, DocumentShape.SOURCE);
        Optional<Element> target = XmlElements.firstChild(container, DocumentShape.TARGET);
        if (source.isEmpty() || target.isEmpty()) {
            LOGGER.debug("Skipping unit {} without both source and target", id);
            return Optional.empty();
        }
        return Optional.of(new TranslationUnit(id, XmlElements.text(source.get()), XmlElements.text(target.get())));
    }

    static Optional<TranslationUnit> fromSegment(String id, Element segment) {
        Optional<Element> source = XmlElements.firstChildOrDescendant(segment, DocumentShape.SOURCE);
        Optional<Element> target = XmlElements.firstChildOrDescendant(segment, DocumentShape.TARGET);
        if (source.isEmpty() || target.isEmpty()) {
            LOGGER.debug("Skipping segment {} without both source and target", id);
            return Optional.empty();
        }
        return Optional.of(new TranslationUnit(id, XmlElements.text(source.get()), XmlElements.text(target.get())));
    }

    private abstract static class LookaheadIterator implements Iterator<TranslationUnit> {

        private TranslationUnit next;

        protected abstract TranslationUnit computeNext();

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = computeNext();
            }
            return next != null;
        }

        @Override
        public TranslationUnit next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TranslationUnit result = next;
            next = null;
            return result;
        }
    }

    private static final class FlatIterator extends LookaheadIterator {

        private final NodeList transUnits;
        private int index;

        private FlatIterator(NodeList transUnits) {
            this.transUnits = transUnits;
        }

        @Override
        protected TranslationUnit computeNext() {
            while (index < transUnits.getLength()) {
                Element transUnit = (Element) transUnits.item(index++);
                Optional<TranslationUnit> unit = fromPair(transUnit.getAttribute("id"), transUnit);
                if (unit.isPresent()) {
                    return unit.get();
                }
            }
            return null;
        }
    }

    private static final class SegmentedIterator extends LookaheadIterator {

        private final NodeList units;
        private int unitIndex;
        private String unitId;
        private List<Element> segments = List.of();
        private int segmentIndex;

        private SegmentedIterator(NodeList units) {
            this.units = units;
        }

        @Override
        protected TranslationUnit computeNext() {
            while (true) {
                while (segmentIndex < segments.size()) {
                    Element segment = segments.get(segmentIndex++);
                    String id = segments.size() == 1 ? unitId : unitId + ":" + segmentIndex;
                    Optional<TranslationUnit> unit = fromSegment(id, segment);
                    if (unit.isPresent()) {
                        return unit.get();
                    }
                }
                if (unitIndex >= units.getLength()) {
                    return null;
                }
                Element unit = (Element) units.item(unitIndex++);
                unitId = unit.getAttribute("id");
                segments = segmentsOf(unit);
                segmentIndex = 0;
            }
        }

        private static List<Element> segmentsOf(Element unit) {
            List<Element> direct = XmlElements.children(unit, DocumentShape.SEGMENT);
            if (!direct.isEmpty()) {
                return direct;
            }
            return XmlElements.descendants(unit, DocumentShape.SEGMENT);
        }
    }
}
