package io.markpeg.tools;

import io.markpeg.parser.api.Formatter;
import io.markpeg.parser.api.MarkdownException;
import io.markpeg.parser.api.MarkdownOptions;
import io.markpeg.parser.api.MarkdownParser;
import io.markpeg.parser.format.HtmlFormatter;
import io.markpeg.parser.format.OutlineFormatter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Converts Markdown files to HTML.
 *
 * <p>Each file is converted on its own; a file that fails is reported on stderr and the remaining
 * ones are still processed. The exit code is 1 if any file failed.
 */
@CommandLine.Command(
    name = "markpeg",
    description = "Converts Markdown to HTML",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class MarkdownTool implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(MarkdownTool.class);

  @CommandLine.Option(
      names = {"-s", "--smart"},
      description = "Typographic quotes, dashes and ellipses")
  private boolean smart;

  @CommandLine.Option(names = {"-n", "--notes"}, description = "Enable footnotes")
  private boolean notes;

  @CommandLine.Option(names = "--filter-html", description = "Drop raw HTML")
  private boolean filterHtml;

  @CommandLine.Option(names = "--filter-styles", description = "Drop <style> blocks")
  private boolean filterStyles;

  @CommandLine.Option(names = {"-d", "--dlists"}, description = "Enable definition lists")
  private boolean definitionLists;

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Properties file with markdown.* options; flags add to it")
  private Path config;

  @CommandLine.Option(
      names = {"-o", "--output"},
      description = "Write to this file instead of stdout")
  private Path output;

  @CommandLine.Option(names = "--tree", description = "Print the element outline instead of HTML")
  private boolean tree;

  @CommandLine.Parameters(paramLabel = "FILE", description = "Markdown files; stdin if none")
  private List<Path> files = new ArrayList<>();

  public static void main(String[] args) {
    int exitCode = new CommandLine(new MarkdownTool()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    MarkdownOptions options;
    try {
      options = options();
    } catch (IOException e) {
      System.err.println("Error: cannot read config " + config + ": " + e.getMessage());
      return 1;
    }
    log.debug("Converting {} file(s) with {}", files.size(), options);
    MarkdownParser parser = MarkdownParser.create(options);
    Writer out =
        output != null
            ? Files.newBufferedWriter(output, StandardCharsets.UTF_8)
            : new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    int failures = 0;
    try {
      if (files.isEmpty()) {
        failures += convert(parser, "<stdin>", System.in, out);
      }
      for (Path file : files) {
        if (!Files.isReadable(file)) {
          System.err.println("Error: file not found: " + file);
          failures++;
          continue;
        }
        try (InputStream in = Files.newInputStream(file)) {
          failures += convert(parser, file.toString(), in, out);
        }
      }
    } finally {
      if (output != null) {
        out.close();
      } else {
        out.flush();
      }
    }
    return failures == 0 ? 0 : 1;
  }

  private MarkdownOptions options() throws IOException {
    MarkdownOptions base = config != null ? MarkdownOptions.load(config) : MarkdownOptions.DEFAULT;
    MarkdownOptions.Builder builder = base.toBuilder();
    if (smart) builder.smart(true);
    if (notes) builder.notes(true);
    if (filterHtml) builder.filterHtml(true);
    if (filterStyles) builder.filterStyles(true);
    if (definitionLists) builder.definitionLists(true);
    return builder.build();
  }

  private int convert(MarkdownParser parser, String name, InputStream in, Writer out)
      throws IOException {
    StringBuilder sb = new StringBuilder();
    Formatter formatter = tree ? new OutlineFormatter(sb) : new HtmlFormatter(sb);
    try {
      parser.markdown(in, formatter);
    } catch (MarkdownException e) {
      System.err.println("Error: " + name + ": " + e.getMessage());
      log.debug("Conversion of {} failed", name, e);
      return 1;
    }
    out.write(sb.toString());
    return 0;
  }
}
