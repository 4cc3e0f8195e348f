package ai.docsite.corpus.segment;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a plain text file into an XLIFF 1.2 skeleton with one {@code trans-unit} per sentence.
 * Targets start out as copies of their sources.
 */
public class XliffExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(XliffExporter.class);

    public static final String OUTPUT_FILE = "translation.xml";
    static final String SOURCE_LANGUAGE = "en-US";
    static final String TARGET_LANGUAGE = "ja";

    private final SentenceSegmenter segmenter;

    public XliffExporter(SentenceSegmenter segmenter) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
    }

    /**
     * Writes {@value #OUTPUT_FILE} next to the input file.
     *
     * @return the written file, or empty when the input has no visible text
     */
    public Optional<Path> export(Path inputFile) {
        String text;
        try {
            text = Files.readString(inputFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read input text: " + inputFile, ex);
        }
        if (text.isBlank()) {
            LOGGER.info("{} has no text; nothing exported", inputFile);
            return Optional.empty();
        }

        List<String> sentences = segmenter.split(text);
        if (sentences.isEmpty()) {
            sentences = List.of(text);
        }

        Path output = inputFile.toAbsolutePath().resolveSibling(OUTPUT_FILE);
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(sentences, inputFile.getFileName().toString(), writer);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write XLIFF: " + output, ex);
        }
        LOGGER.info("Exported {} sentences to {}", sentences.size(), output);
        return Optional.of(output);
    }

    void write(List<String> sentences, String original, Writer out) throws IOException {
        try {
            XMLStreamWriter xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            newline(xml, 0);
            xml.writeStartElement("xliff");
            xml.writeAttribute("version", "1.2");
            newline(xml, 1);
            xml.writeStartElement("file");
            xml.writeAttribute("source-language", SOURCE_LANGUAGE);
            xml.writeAttribute("target-language", TARGET_LANGUAGE);
            xml.writeAttribute("datatype", "plaintext");
            xml.writeAttribute("original", original);
            newline(xml, 2);
            xml.writeStartElement("body");
            int id = 1;
            for (String sentence : sentences) {
                newline(xml, 3);
                xml.writeStartElement("trans-unit");
                xml.writeAttribute("id", Integer.toString(id++));
                newline(xml, 4);
                preserved(xml, "source", sentence);
                newline(xml, 4);
                preserved(xml, "target", sentence);
                newline(xml, 3);
                xml.writeEndElement();
            }
            newline(xml, 2);
            xml.writeEndElement();
            newline(xml, 1);
            xml.writeEndElement();
            newline(xml, 0);
            xml.writeEndElement();
            xml.writeCharacters("\n");
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException ex) {
            throw new IOException("Failed to serialize XLIFF", ex);
        }
    }

    private static void preserved(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeAttribute("xml:space", "preserve");
        xml.writeCharacters(text);
        xml.writeEndElement();
    }

    private static void newline(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters("\n" + "  ".repeat(depth));
    }
}
