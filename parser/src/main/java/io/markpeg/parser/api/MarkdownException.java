package io.markpeg.parser.api;

/**
 * Base exception for every failure of a Markdown conversion.
 *
 * <p>Malformed Markdown is never reported here; it is kept as literal text. An exception means the
 * conversion itself broke down: the grammar matched nothing at a non-blank position ({@code
 * GRAMMAR}), the engine buffer was not drained between rules ({@code BUFFER}), RAW re-parsing did
 * not converge ({@code RESOLUTION}), or reading the input or writing through the formatter failed
 * ({@code IO}). The context is a short, escaped excerpt of the Markdown being processed, or the
 * pass or block the failure happened in.
 */
public class MarkdownException extends Exception {
    private final String context;
    private final String errorCode;

    public MarkdownException(String message) {
        this(message, null, null);
    }

    public MarkdownException(String message, Throwable cause) {
        this(message, cause, null, null);
    }

    public MarkdownException(String message, String context, String errorCode) {
        this(message, null, context, errorCode);
    }

    public MarkdownException(String message, Throwable cause, String context, String errorCode) {
        super(formatMessage(message, context, errorCode), cause);
        this.context = context;
        this.errorCode = errorCode;
    }

    private static String formatMessage(String message, String context, String errorCode) {
        StringBuilder sb = new StringBuilder(message);
        if (context != null) {
            sb.append(" [Context: ").append(context).append("]");
        }
        if (errorCode != null) {
            sb.append(" [Error Code: ").append(errorCode).append("]");
        }
        return sb.toString();
    }

    /** Shortens {@code text} to at most 40 characters and escapes line breaks. */
    static String excerpt(String text) {
        String s = text.length() > 40 ? text.substring(0, 37) + "..." : text;
        return s.replace("\n", "\\n").replace("\r", "\\r");
    }

    public String getContext() {
        return context;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
