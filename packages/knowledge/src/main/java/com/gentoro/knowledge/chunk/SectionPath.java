package com.gentoro.knowledge.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Immutable heading path, outermost heading first. */
public final class SectionPath {
  private static final SectionPath ROOT = new SectionPath(List.of());

  private final List<String> headings;

  private SectionPath(List<String> headings) {
    this.headings = headings;
  }

  public static SectionPath root() {
    return ROOT;
  }

  public static SectionPath of(List<String> headings) {
    return headings == null || headings.isEmpty() ? ROOT : new SectionPath(List.copyOf(headings));
  }

  public int depth() {
    return headings.size();
  }

  /** Keep at most {@code depth} outer headings. */
  public SectionPath truncate(int depth) {
    if (depth >= headings.size()) return this;
    return depth <= 0 ? ROOT : new SectionPath(headings.subList(0, depth));
  }

  public SectionPath push(String heading) {
    List<String> next = new ArrayList<>(headings.size() + 1);
    next.addAll(headings);
    next.add(heading);
    return new SectionPath(List.copyOf(next));
  }

  public Optional<String> innermost() {
    return headings.isEmpty() ? Optional.empty() : Optional.of(headings.get(headings.size() - 1));
  }

  public List<String> asList() {
    return headings;
  }

  public String join(String separator) {
    return String.join(separator, headings);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SectionPath other && headings.equals(other.headings);
  }

  @Override
  public int hashCode() {
    return headings.hashCode();
  }

  @Override
  public String toString() {
    return join(" > ");
  }
}
