/**
 * Public API for the markpeg Markdown parser.
 *
 * <p><b>Usage</b>
 *
 * <ul>
 *   <li>Create a {@link io.markpeg.parser.api.MarkdownParser} with the desired {@link
 *       io.markpeg.parser.api.MarkdownOptions} and <b>reuse</b> it for many documents.
 *   <li>Implement {@link io.markpeg.parser.api.Formatter} to receive each top-level block as an
 *       {@link io.markpeg.parser.api.ElementTree}, or use {@link
 *       io.markpeg.parser.format.HtmlFormatter}.
 *   <li>The formatter is invoked synchronously on the parsing thread.
 * </ul>
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * MarkdownParser parser = MarkdownParser.create(MarkdownOptions.builder().notes(true).build());
 * parser.markdown(in, block -> {
 *   for (Element e : block.roots()) {
 *     System.out.println(e.kind() + ": " + e.text());
 *   }
 * });
 * }</pre>
 */
package io.markpeg.parser.api;
