package io.markpeg.parser.api;

/**
 * Thrown when a grammar rule is about to be invoked while the previous invocation left text
 * unconsumed. This is a contract violation between the driver and the grammar engine, not a
 * problem with the user's input.
 */
public class BufferStateException extends MarkdownException {

    public BufferStateException(String message, String context) {
        super(message, context, "BUFFER");
    }

    /**
     * Creates a BufferStateException for a leftover remainder.
     *
     * @param rule the rule that was about to be invoked
     * @param remainder the text the previous invocation did not consume
     * @return a new BufferStateException instance
     */
    public static BufferStateException bufferNotEmpty(String rule, String remainder) {
        return new BufferStateException(
            String.format("Buffer not empty before %s (%d chars left)", rule, remainder.length()),
            excerpt(remainder)
        );
    }
}
