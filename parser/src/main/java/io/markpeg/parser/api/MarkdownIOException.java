package io.markpeg.parser.api;

import java.io.IOException;

/**
 * Exception thrown for I/O related errors while reading Markdown input or writing formatter output.
 */
public class MarkdownIOException extends MarkdownException {

    /**
     * Constructs a new MarkdownIOException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public MarkdownIOException(String message, Throwable cause) {
        super(message, cause, null, "IO");
    }

    /**
     * Constructs a new MarkdownIOException with the specified message, cause, and context.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param context the context information
     */
    public MarkdownIOException(String message, Throwable cause, String context) {
        super(message, cause, context, "IO");
    }

    /**
     * Creates a MarkdownIOException for an input read error.
     *
     * @param cause the underlying IOException
     * @return a new MarkdownIOException instance
     */
    public static MarkdownIOException readError(IOException cause) {
        return new MarkdownIOException("Failed to read Markdown input", cause, "INPUT");
    }

    /**
     * Creates a MarkdownIOException for a formatter that failed to write its output.
     *
     * @param blockIndex the 1-based index of the block being formatted, or 0 for {@code finish()}
     * @param cause the underlying IOException
     * @return a new MarkdownIOException instance
     */
    public static MarkdownIOException formatterError(int blockIndex, IOException cause) {
        return new MarkdownIOException(
            "Formatter failed",
            cause,
            blockIndex == 0 ? "finish" : "block-" + blockIndex
        );
    }
}
