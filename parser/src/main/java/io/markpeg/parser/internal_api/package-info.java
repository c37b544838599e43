/**
 * Internal implementation details of the markpeg parser.
 *
 * <p><b>WARNING: This entire package is internal and subject to change without notice.</b>
 *
 * <p>{@link io.markpeg.parser.api.ElementTree} and {@link io.markpeg.parser.api.Element} expose
 * {@link io.markpeg.parser.internal_api.ElementArena} and {@link
 * io.markpeg.parser.internal_api.RawContent} in their signatures. Formatters should not need to
 * mutate the arena; treat it as read-only.
 */
package io.markpeg.parser.internal_api;
