package ai.docsite.corpus.xliff;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses XLIFF files into namespace-aware DOM trees. External entities and DTDs are never fetched.
 */
public class XliffDocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(XliffDocumentLoader.class);

    public Document load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        try (InputStream input = Files.newInputStream(path)) {
            InputSource source = new InputSource(input);
            source.setSystemId(path.toUri().toString());
            return parse(source, path.toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read XLIFF document: " + path, ex);
        }
    }

    public Document parse(String xml) {
        if (xml == null) {
            throw new IllegalArgumentException("xml must be provided");
        }
        try {
            return parse(new InputSource(new StringReader(xml)), "<string>");
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read XLIFF document", ex);
        }
    }

    private Document parse(InputSource source, String description) throws IOException {
        try {
            DocumentBuilder builder = newDocumentBuilder();
            Document document = builder.parse(source);
            LOGGER.debug("Parsed XLIFF document {} (root element {})", description,
                    document.getDocumentElement().getNodeName());
            return document;
        } catch (SAXException ex) {
            throw new XliffParseException("Failed to parse XML in " + description + ": " + ex.getMessage(), ex);
        }
    }

    private DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new FailFastErrorHandler());
            return builder;
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser does not support the required configuration", ex);
        }
    }

    private static final class FailFastErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            LOGGER.warn("XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
