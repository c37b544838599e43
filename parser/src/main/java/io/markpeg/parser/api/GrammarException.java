package io.markpeg.parser.api;

/**
 * Thrown when the grammar engine cannot match the requested rule at all. Fatal for the document
 * being parsed, but not for the parser instance: it can be reused for the next document.
 */
public class GrammarException extends MarkdownException {

    public GrammarException(String message) {
        super(message, null, "GRAMMAR");
    }

    public GrammarException(String message, String context) {
        super(message, context, "GRAMMAR");
    }

    public GrammarException(String message, Throwable cause, String context) {
        super(message, cause, context, "GRAMMAR");
    }

    /**
     * Creates a GrammarException for a rule that matched nothing at a position where input remains.
     *
     * @param rule the rule name
     * @param offset the buffer offset at which matching failed
     * @param rest the unmatched text starting at the failing offset
     * @return a new GrammarException instance
     */
    public static GrammarException noMatch(String rule, int offset, String rest) {
        return new GrammarException(
            String.format("Rule %s matched nothing at offset %d", rule, offset),
            excerpt(rest)
        );
    }
}
