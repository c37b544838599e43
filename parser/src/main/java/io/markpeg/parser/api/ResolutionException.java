package io.markpeg.parser.api;

/**
 * Thrown when resolving deferred RAW blocks does not converge, either because the nesting depth
 * exceeds the resolver limit or because a re-parsed segment produced itself again.
 */
public class ResolutionException extends MarkdownException {

    public ResolutionException(String message, String context) {
        super(message, context, "RESOLUTION");
    }

    public static ResolutionException tooDeep(int limit) {
        return new ResolutionException(
            String.format("RAW block nesting exceeds %d levels", limit),
            null
        );
    }

    public static ResolutionException notShrinking(String segment) {
        return new ResolutionException(
            "Re-parsing a RAW segment produced the same segment again",
            excerpt(segment)
        );
    }
}
