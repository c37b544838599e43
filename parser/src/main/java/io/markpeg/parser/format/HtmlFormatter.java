package io.markpeg.parser.format;

import io.markpeg.parser.api.Element;
import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.Formatter;
import io.markpeg.parser.api.LinkTarget;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Renders parsed blocks as HTML.
 *
 * <p>Block elements are separated by a blank line, list items and closing list tags by a line
 * break. Note references are numbered in order of appearance and the note bodies are written as
 * an ordered list when the document is finished.
 */
public final class HtmlFormatter implements Formatter {
  private final Appendable out;
  private final List<Element> notes = new ObjectArrayList<>();
  private int padded = 2;

  public HtmlFormatter(Appendable out) {
    this.out = Objects.requireNonNull(out, "out must not be null");
  }

  @Override
  public void formatBlock(ElementTree block) throws IOException {
    for (Element e : block.roots()) {
      element(e);
    }
  }

  @Override
  public void finish() throws IOException {
    if (!notes.isEmpty()) {
      pad(2);
      out.append("<hr/>\n<ol id=\"notes\">");
      padded = 0;
      for (int i = 0; i < notes.size(); i++) {
        int n = i + 1;
        pad(1);
        out.append("<li id=\"fn").append(String.valueOf(n)).append("\">");
        padded = 2;
        children(notes.get(i));
        out.append(" <a href=\"#fnref").append(String.valueOf(n))
            .append("\" title=\"Jump back to reference\">[back]</a></li>");
        padded = 0;
      }
      pad(1);
      out.append("</ol>");
    }
    out.append('\n');
  }

  private void pad(int n) throws IOException {
    while (padded < n) {
      out.append('\n');
      padded++;
    }
  }

  private void children(Element e) throws IOException {
    for (Element child : e.children()) {
      element(child);
    }
  }

  private void element(Element e) throws IOException {
    switch (e.kind()) {
      case SPACE:
        out.append(e.contents());
        break;
      case LINEBREAK:
        out.append("<br/>\n");
        break;
      case STR:
        escape(e.contents());
        break;
      case ELLIPSIS:
        out.append("&hellip;");
        break;
      case EMDASH:
        out.append("&mdash;");
        break;
      case ENDASH:
        out.append("&ndash;");
        break;
      case APOSTROPHE:
        out.append("&rsquo;");
        break;
      case SINGLEQUOTED:
        wrap("&lsquo;", e, "&rsquo;");
        break;
      case DOUBLEQUOTED:
        wrap("&ldquo;", e, "&rdquo;");
        break;
      case CODE:
        out.append("<code>");
        escape(e.contents());
        out.append("</code>");
        break;
      case HTML:
        out.append(e.contents());
        break;
      case LINK:
        link(e);
        break;
      case IMAGE:
        image(e);
        break;
      case EMPH:
        wrap("<em>", e, "</em>");
        break;
      case STRONG:
        wrap("<strong>", e, "</strong>");
        break;
      case LIST:
        children(e);
        break;
      case RAW:
        throw new IllegalStateException("Unresolved RAW element " + e.id());
      case H1:
      case H2:
      case H3:
      case H4:
      case H5:
      case H6:
        {
          String tag = "h" + e.kind().headingLevel();
          pad(2);
          wrap("<" + tag + ">", e, "</" + tag + ">");
          padded = 0;
          break;
        }
      case PLAIN:
        pad(1);
        children(e);
        padded = 0;
        break;
      case PARA:
        pad(2);
        wrap("<p>", e, "</p>");
        padded = 0;
        break;
      case HRULE:
        pad(2);
        out.append("<hr />");
        padded = 0;
        break;
      case HTMLBLOCK:
        pad(2);
        out.append(e.contents());
        padded = 0;
        break;
      case VERBATIM:
        pad(2);
        out.append("<pre><code>");
        escape(e.contents());
        out.append("</code></pre>");
        padded = 0;
        break;
      case BULLETLIST:
        container("ul", e);
        break;
      case ORDEREDLIST:
        container("ol", e);
        break;
      case DEFINITIONLIST:
        container("dl", e);
        break;
      case LISTITEM:
        item("li", e);
        break;
      case DEFTITLE:
        item("dt", e);
        break;
      case DEFDATA:
        item("dd", e);
        break;
      case BLOCKQUOTE:
        pad(2);
        out.append("<blockquote>\n");
        padded = 2;
        children(e);
        pad(1);
        out.append("</blockquote>");
        padded = 0;
        break;
      case REFERENCE:
        break;
      case NOTE:
        // definitions carry no children and render nothing
        if (e.hasChildren()) {
          notes.add(e);
          String n = String.valueOf(notes.size());
          out.append("<a class=\"noteref\" id=\"fnref").append(n)
              .append("\" href=\"#fn").append(n)
              .append("\" title=\"Jump to note ").append(n)
              .append("\">[").append(n).append("]</a>");
        }
        break;
      default:
        throw new IllegalStateException("Unexpected element kind " + e.kind());
    }
  }

  private void wrap(String open, Element e, String close) throws IOException {
    out.append(open);
    children(e);
    out.append(close);
  }

  private void container(String tag, Element e) throws IOException {
    pad(2);
    out.append('<').append(tag).append('>');
    padded = 0;
    children(e);
    pad(1);
    out.append("</").append(tag).append('>');
    padded = 0;
  }

  private void item(String tag, Element e) throws IOException {
    pad(1);
    out.append('<').append(tag).append('>');
    padded = 2;
    children(e);
    out.append("</").append(tag).append('>');
    padded = 0;
  }

  private void link(Element e) throws IOException {
    LinkTarget target = e.target();
    out.append("<a href=\"");
    escape(target.url());
    out.append('"');
    title(target);
    out.append('>');
    children(e);
    out.append("</a>");
  }

  private void image(Element e) throws IOException {
    LinkTarget target = e.target();
    out.append("<img src=\"");
    escape(target.url());
    out.append("\" alt=\"");
    escape(e.text());
    out.append('"');
    title(target);
    out.append(" />");
  }

  private void title(LinkTarget target) throws IOException {
    if (!target.title().isEmpty()) {
      out.append(" title=\"");
      escape(target.title());
      out.append('"');
    }
  }

  private void escape(String text) throws IOException {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&':
          out.append("&amp;");
          break;
        case '<':
          out.append("&lt;");
          break;
        case '>':
          out.append("&gt;");
          break;
        case '"':
          out.append("&quot;");
          break;
        default:
          out.append(c);
      }
    }
  }
}
