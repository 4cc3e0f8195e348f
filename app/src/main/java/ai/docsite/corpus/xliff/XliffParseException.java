package ai.docsite.corpus.xliff;

/**
 * Raised when an XLIFF document is not well-formed XML. No units are produced in that case.
 */
public class XliffParseException extends RuntimeException {

    public XliffParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
