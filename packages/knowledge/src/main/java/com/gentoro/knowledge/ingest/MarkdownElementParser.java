package com.gentoro.knowledge.ingest;

import com.gentoro.knowledge.chunk.ElementType;
import com.gentoro.knowledge.chunk.ParsedElement;
import com.gentoro.knowledge.exception.IoException;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.CodeBlock;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.ext.tables.TableSeparator;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses markdown with flexmark into {@link ParsedElement}s: headings with their ancestor path and
 * level, paragraphs, lists, code blocks, GFM tables with their rows, and image-only paragraphs as
 * figures. Raw HTML and thematic breaks are dropped.
 */
public class MarkdownElementParser {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(MarkdownElementParser.class);

  private final Parser parser;

  public MarkdownElementParser() {
    MutableDataSet options = new MutableDataSet();
    options.set(Parser.EXTENSIONS, Arrays.asList(TablesExtension.create()));
    this.parser = Parser.builder(options).build();
  }

  /** Parse a UTF-8 markdown file; read failures surface as {@link IoException}. */
  public List<ParsedElement> parse(Path file) {
    try {
      return parse(Files.readString(file));
    } catch (IOException e) {
      throw new IoException("Failed to read markdown file: " + file, e);
    }
  }

  public List<ParsedElement> parse(String markdown) {
    List<ParsedElement> out = new ArrayList<>();
    if (markdown == null || markdown.isBlank()) return out;

    Node root = parser.parse(markdown);
    Deque<HeadingEntry> headings = new ArrayDeque<>();
    for (Node node = root.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof Heading h) {
        while (!headings.isEmpty() && headings.peekLast().level() >= h.getLevel()) {
          headings.removeLast();
        }
        String text = h.getText().toString().trim();
        List<String> ancestors = path(headings);
        headings.addLast(new HeadingEntry(h.getLevel(), text));
        out.add(
            new ParsedElement(
                ElementType.HEADING.wireName(),
                text,
                ancestors,
                text,
                null,
                Map.of(ParsedElement.LEVEL, h.getLevel())));
      } else if (node instanceof TableBlock table) {
        out.add(table(table, path(headings)));
      } else if (node instanceof FencedCodeBlock code) {
        out.add(element(ElementType.CODE, code.getContentChars().toString(), headings));
      } else if (node instanceof CodeBlock code) {
        out.add(element(ElementType.CODE, code.getContentChars().toString(), headings));
      } else if (node instanceof BulletList || node instanceof OrderedList) {
        out.add(element(ElementType.LIST, node.getChars().toString(), headings));
      } else if (node instanceof Paragraph p && isImageOnly(p)) {
        out.add(figure(p, path(headings)));
      } else if (node instanceof HtmlBlock || node instanceof ThematicBreak) {
        log.trace("Dropping {} node", node.getNodeName());
      } else if (node instanceof BlockQuote || node instanceof Paragraph) {
        String text = node.getChars().toString().trim();
        if (!text.isEmpty()) out.add(element(ElementType.PARAGRAPH, text, headings));
      } else {
        String text = node.getChars().toString().trim();
        if (!text.isEmpty()) {
          log.debug("Treating {} node as paragraph", node.getNodeName());
          out.add(element(ElementType.PARAGRAPH, text, headings));
        }
      }
    }
    log.debug("Parsed markdown into {} elements", out.size());
    return out;
  }

  private static ParsedElement element(
      ElementType type, String content, Deque<HeadingEntry> headings) {
    return new ParsedElement(type.wireName(), content.trim(), path(headings), null, null, null);
  }

  private static ParsedElement table(TableBlock table, List<String> ancestors) {
    List<List<String>> rows = new ArrayList<>();
    collectRows(table, rows);
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put(ParsedElement.TABLE_DATA, rows);
    return new ParsedElement(
        ElementType.TABLE.wireName(),
        table.getChars().toString().trim(),
        ancestors,
        null,
        null,
        meta);
  }

  private static void collectRows(Node parent, List<List<String>> rows) {
    for (Node child : parent.getChildren()) {
      if (child instanceof TableSeparator) continue;
      if (child instanceof TableRow row) {
        List<String> cells = new ArrayList<>();
        for (Node cell : row.getChildren()) {
          if (cell instanceof TableCell c) cells.add(c.getText().toString().trim());
        }
        rows.add(cells);
      } else {
        collectRows(child, rows);
      }
    }
  }

  private static ParsedElement figure(Paragraph paragraph, List<String> ancestors) {
    List<String> captions = new ArrayList<>();
    for (Node child : paragraph.getChildren()) {
      if (child instanceof Image image) {
        String alt = image.getText().toString().trim();
        if (!alt.isEmpty()) captions.add(alt);
      }
    }
    Map<String, Object> meta = new LinkedHashMap<>();
    if (!captions.isEmpty()) meta.put(ParsedElement.CAPTION, String.join("; ", captions));
    return new ParsedElement(ElementType.FIGURE.wireName(), "", ancestors, null, null, meta);
  }

  private static boolean isImageOnly(Paragraph paragraph) {
    boolean sawImage = false;
    for (Node child : paragraph.getChildren()) {
      if (child instanceof Image) {
        sawImage = true;
      } else if (!(child instanceof SoftLineBreak)
          && !(child instanceof Text && child.getChars().isBlank())) {
        return false;
      }
    }
    return sawImage;
  }

  private static List<String> path(Deque<HeadingEntry> headings) {
    List<String> out = new ArrayList<>(headings.size());
    for (HeadingEntry h : headings) out.add(h.text());
    return out;
  }

  private record HeadingEntry(int level, String text) {}
}
