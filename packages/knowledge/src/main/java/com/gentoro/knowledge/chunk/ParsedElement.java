package com.gentoro.knowledge.chunk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One structural element produced by a document parser.
 *
 * <p>{@code rawType} is kept exactly as the parser supplied it so that unrecognised kinds can be
 * reported; {@link #type()} resolves it. Recognised metadata keys are {@value #TABLE_DATA} (list of
 * rows, each a list of cell values), {@value #CAPTION} and {@value #LEVEL} (heading level 1..6).
 *
 * @param sectionHierarchy ancestor headings, outermost first, excluding the element itself
 * @param heading the heading text when the element is itself a heading
 */
public record ParsedElement(
    String rawType,
    String content,
    List<String> sectionHierarchy,
    String heading,
    List<Integer> pageNumbers,
    Map<String, Object> metadata) {

  public static final String TABLE_DATA = "table_data";
  public static final String CAPTION = "caption";
  public static final String LEVEL = "level";

  public ParsedElement {
    content = content == null ? "" : content;
    sectionHierarchy = sectionHierarchy == null ? List.of() : List.copyOf(sectionHierarchy);
    pageNumbers = pageNumbers == null ? List.of() : List.copyOf(pageNumbers);
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static ParsedElement of(String rawType, String content) {
    return new ParsedElement(rawType, content, null, null, null, null);
  }

  public static ParsedElement heading(String text, int level) {
    return new ParsedElement(
        ElementType.HEADING.wireName(), text, null, text, null, Map.of(LEVEL, level));
  }

  public static ParsedElement paragraph(String text) {
    return of(ElementType.PARAGRAPH.wireName(), text);
  }

  public static ParsedElement table(List<List<String>> rows, String caption) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put(TABLE_DATA, rows);
    if (caption != null) meta.put(CAPTION, caption);
    return new ParsedElement(ElementType.TABLE.wireName(), "", null, null, null, meta);
  }

  public Optional<ElementType> type() {
    return ElementType.fromWireName(rawType);
  }

  public ParsedElement withPages(Integer... pages) {
    return new ParsedElement(
        rawType, content, sectionHierarchy, heading, List.of(pages), metadata);
  }

  public ParsedElement withSectionHierarchy(List<String> ancestors) {
    return new ParsedElement(rawType, content, ancestors, heading, pageNumbers, metadata);
  }

  public ParsedElement withMetadata(String key, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(metadata);
    copy.put(key, value);
    return new ParsedElement(rawType, content, sectionHierarchy, heading, pageNumbers, copy);
  }

  /** Heading text, falling back to the content when the parser left {@code heading} empty. */
  public String headingText() {
    String text = heading == null || heading.isBlank() ? content : heading;
    return text.trim();
  }

  public Optional<String> caption() {
    Object value = metadata.get(CAPTION);
    if (value == null || value.toString().isBlank()) return Optional.empty();
    return Optional.of(value.toString().trim());
  }

  /** Heading level from metadata; empty when absent or not a number. */
  public Optional<Integer> level() {
    Object value = metadata.get(LEVEL);
    if (value instanceof Number n) return Optional.of(n.intValue());
    if (value instanceof String s) {
      try {
        return Optional.of(Integer.parseInt(s.trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /** Table rows from metadata with every cell rendered as text; empty when absent or malformed. */
  public List<List<String>> tableRows() {
    Object value = metadata.get(TABLE_DATA);
    if (!(value instanceof List<?> rows)) return List.of();
    List<List<String>> out = new ArrayList<>();
    for (Object row : rows) {
      if (!(row instanceof List<?> cells)) continue;
      List<String> rendered = new ArrayList<>();
      for (Object cell : cells) {
        rendered.add(cell == null ? "" : cell.toString());
      }
      out.add(rendered);
    }
    return out;
  }
}
