package com.gentoro.knowledge.chunk;

import com.gentoro.knowledge.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structure-aware chunker for standards and technical documents.
 *
 * <p>Walks parsed elements in document order, keeping the heading path of the current section:
 *
 * <ul>
 *   <li>A heading closes the current text buffer and opens a section. It is merged into the first
 *       text of its section, or emitted alone as a {@link ChunkType#HEADING} chunk when a table,
 *       another heading or the end of the document comes first.
 *   <li>A table is always emitted whole as one {@link ChunkType#TABLE} chunk, whatever its size.
 *   <li>Paragraphs, lists, code and figure captions accumulate until the buffer reaches {@code
 *       chunkSizeMax}; the next buffer then starts with the last {@code chunkOverlap} tokens.
 *       Oversized paragraphs and lists are split at paragraph, sentence, then word boundaries.
 *       Code is never split.
 * </ul>
 *
 * <p>Overlap never crosses a heading or a table. Instances are stateless between calls and safe to
 * share.
 */
public class HierarchicalChunker implements Chunker {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(HierarchicalChunker.class);

  private static final String CLAUSE_PREFIX = "(?:(?i:clause|section)\\s+)";
  private static final String NUMBERING = "(?:[A-Z]|\\d+)(?:\\.\\d+)+";
  private static final String BOUNDARY = "(?=$|[\\s.:)\\-])";

  // Headings may carry a bare top-level number ("4 Requirements").
  private static final Pattern HEADING_CLAUSE =
      Pattern.compile("^\\s*" + CLAUSE_PREFIX + "?(" + NUMBERING + "|\\d+)" + BOUNDARY);
  // Body text needs dotted numbering or an explicit prefix, "3 engineers" is not a clause.
  private static final Pattern TEXT_CLAUSE =
      Pattern.compile(
          "^\\s*(?:"
              + CLAUSE_PREFIX
              + "("
              + NUMBERING
              + "|\\d+)|("
              + NUMBERING
              + "))"
              + BOUNDARY);

  private static final String PART_SEPARATOR = "\n\n";

  private final ChunkConfig config;
  private final TokenCounter tokens;
  private final TextSplitter splitter;

  public HierarchicalChunker() {
    this(ChunkConfig.defaults(), new Cl100kTokenCounter());
  }

  public HierarchicalChunker(ChunkConfig config, TokenCounter tokens) {
    this.config = config == null ? ChunkConfig.defaults() : config;
    this.tokens = tokens == null ? new Cl100kTokenCounter() : tokens;
    // leave room for the overlap the piece may be appended after
    this.splitter =
        new TextSplitter(this.tokens, this.config.chunkSizeMax() - this.config.chunkOverlap());
  }

  public ChunkConfig config() {
    return config;
  }

  @Override
  public ChunkingReport chunkWithReport(List<ParsedElement> elements, DocumentMetadata document) {
    if (elements == null) {
      throw new ValidationException("elements must not be null");
    }
    Assembly out = new Assembly();
    SectionPath path = SectionPath.root();
    int skipped = 0;

    for (ParsedElement element : elements) {
      Optional<ElementType> type = element == null ? Optional.empty() : element.type();
      if (type.isEmpty()) {
        skipped++;
        log.warn(
            "Skipping unrecognised element type '{}' in document {}",
            element == null ? null : element.rawType(),
            documentId(document));
        continue;
      }
      path =
          switch (type.get()) {
            case HEADING -> openSection(element, path, out);
            case TABLE -> emitTable(element, path, out);
            case PARAGRAPH, LIST -> appendSplit(element, path, out);
            case CODE -> append(element.content(), element, path, out);
            case FIGURE -> append(figureText(element), element, path, out);
          };
    }

    out.flushStructural(path);
    out.emitPendingHeading();

    log.debug(
        "Chunked document {}: {} elements -> {} chunks ({} skipped)",
        documentId(document),
        elements.size(),
        out.chunks.size(),
        skipped);
    return new ChunkingReport(out.chunks, skipped);
  }

  private SectionPath openSection(ParsedElement element, SectionPath path, Assembly out) {
    String text = element.headingText();
    out.flushStructural(path);
    out.emitPendingHeading();
    if (text.isEmpty()) {
      log.debug("Ignoring heading without text");
      return path;
    }
    SectionPath next = path.truncate(headingDepth(element, text)).push(text);
    out.pendingHeading = new PendingHeading(text, next, element.pageNumbers());
    return next;
  }

  private SectionPath emitTable(ParsedElement element, SectionPath path, Assembly out) {
    out.flushStructural(path);
    out.emitPendingHeading();
    String rendered = TableRenderer.render(element);
    if (rendered.isEmpty()) {
      log.debug("Ignoring table without rows or content");
      return path;
    }
    Map<String, Object> meta = new LinkedHashMap<>();
    element.caption().ifPresent(caption -> meta.put(ParsedElement.CAPTION, caption));
    int rows = element.tableRows().size();
    if (rows > 0) meta.put("row_count", rows);
    out.chunks.add(
        new ChunkResult(
            rendered,
            tokens.count(rendered),
            path.asList(),
            clauseFor(path, element.caption().orElse("")),
            element.pageNumbers(),
            ChunkType.TABLE,
            false,
            meta));
    return path;
  }

  private SectionPath appendSplit(ParsedElement element, SectionPath path, Assembly out) {
    for (String piece : splitter.split(element.content())) {
      append(piece, element, path, out);
    }
    return path;
  }

  private SectionPath append(String text, ParsedElement element, SectionPath path, Assembly out) {
    if (text == null || text.isBlank()) return path;
    String piece = text.trim();
    if (out.hasNewContent
        && tokens.count(out.text() + PART_SEPARATOR + piece) > config.chunkSizeMax()) {
      out.flushForSize(path);
    }
    out.mergePendingHeading();
    out.parts.add(piece);
    out.pages.addAll(element.pageNumbers());
    out.lastPages = element.pageNumbers();
    out.hasNewContent = true;
    if (tokens.count(out.text()) >= config.chunkSizeMax()) {
      out.flushForSize(path);
    }
    return path;
  }

  private static String figureText(ParsedElement element) {
    return element.content().isBlank() ? element.caption().orElse("") : element.content();
  }

  /**
   * Depth the heading sits at: its ancestor count when the parser supplied one, else its markdown
   * level, else the depth of its clause numbering ({@code 4.2.1} is depth 2).
   */
  private static int headingDepth(ParsedElement element, String text) {
    if (!element.sectionHierarchy().isEmpty()) {
      return element.sectionHierarchy().size();
    }
    Optional<Integer> level = element.level();
    if (level.isPresent() && level.get() >= 1) {
      return level.get() - 1;
    }
    Matcher m = HEADING_CLAUSE.matcher(text);
    if (m.find()) {
      return (int) m.group(1).chars().filter(c -> c == '.').count();
    }
    return 0;
  }

  private static String clauseFor(SectionPath path, String content) {
    Optional<String> heading = path.innermost();
    if (heading.isPresent()) {
      Matcher m = HEADING_CLAUSE.matcher(heading.get());
      if (m.find()) return m.group(1);
    }
    String firstLine = content.lines().findFirst().orElse("");
    Matcher m = TEXT_CLAUSE.matcher(firstLine);
    if (m.find()) return m.group(1) != null ? m.group(1) : m.group(2);
    return null;
  }

  private static String documentId(DocumentMetadata document) {
    return document == null ? "<unknown>" : document.documentId();
  }

  private record PendingHeading(String text, SectionPath path, List<Integer> pages) {}

  /** Per-call mutable state: emitted chunks, the open text buffer and a pending heading. */
  private final class Assembly {
    final List<ChunkResult> chunks = new ArrayList<>();
    final List<String> parts = new ArrayList<>();
    final Set<Integer> pages = new LinkedHashSet<>();
    List<Integer> lastPages = List.of();
    boolean hasNewContent;
    boolean startsWithOverlap;
    PendingHeading pendingHeading;

    String text() {
      return String.join(PART_SEPARATOR, parts);
    }

    /** Section or table boundary: emit new content, carry nothing over. */
    void flushStructural(SectionPath path) {
      if (hasNewContent) emitContent(path);
      reset();
    }

    /** Size limit reached: emit and seed the next buffer with the tail of this one. */
    void flushForSize(SectionPath path) {
      String emitted = emitContent(path);
      List<Integer> carriedPages = lastPages;
      reset();
      if (config.chunkOverlap() == 0) return;
      String tail = tokens.tail(emitted, config.chunkOverlap());
      if (tail.isBlank()) return;
      parts.add(tail);
      pages.addAll(carriedPages);
      lastPages = carriedPages;
      startsWithOverlap = true;
    }

    void mergePendingHeading() {
      if (pendingHeading == null) return;
      parts.add(pendingHeading.text());
      pages.addAll(pendingHeading.pages());
      pendingHeading = null;
    }

    void emitPendingHeading() {
      if (pendingHeading == null) return;
      PendingHeading heading = pendingHeading;
      pendingHeading = null;
      chunks.add(
          new ChunkResult(
              heading.text(),
              tokens.count(heading.text()),
              heading.path().asList(),
              clauseFor(heading.path(), heading.text()),
              heading.pages(),
              ChunkType.HEADING,
              false,
              Map.of()));
    }

    private String emitContent(SectionPath path) {
      String content = text();
      chunks.add(
          new ChunkResult(
              content,
              tokens.count(content),
              path.asList(),
              clauseFor(path, content),
              new ArrayList<>(pages),
              ChunkType.CONTENT,
              startsWithOverlap,
              Map.of()));
      return content;
    }

    private void reset() {
      parts.clear();
      pages.clear();
      lastPages = List.of();
      hasNewContent = false;
      startsWithOverlap = false;
    }
  }
}
