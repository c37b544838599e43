/** Ready-made {@link io.markpeg.parser.api.Formatter} implementations. */
package io.markpeg.parser.format;
