package com.gentoro.knowledge.chunk;

import java.util.List;

/** Renders a table element as markdown with its caption on the first line. */
final class TableRenderer {
  private TableRenderer() {}

  static String render(ParsedElement table) {
    StringBuilder sb = new StringBuilder();
    table.caption().ifPresent(caption -> sb.append(caption).append("\n\n"));
    List<List<String>> rows = table.tableRows();
    if (rows.isEmpty()) {
      sb.append(table.content().trim());
      return sb.toString().trim();
    }
    int columns = rows.stream().mapToInt(List::size).max().orElse(0);
    for (int r = 0; r < rows.size(); r++) {
      appendRow(sb, rows.get(r), columns);
      if (r == 0) {
        sb.append('|');
        for (int c = 0; c < columns; c++) sb.append(" --- |");
        sb.append('\n');
      }
    }
    return sb.toString().trim();
  }

  private static void appendRow(StringBuilder sb, List<String> cells, int columns) {
    sb.append('|');
    for (int c = 0; c < columns; c++) {
      String cell = c < cells.size() ? cells.get(c) : "";
      sb.append(' ').append(cell.replace("\n", " ").replace("|", "\\|").trim()).append(" |");
    }
    sb.append('\n');
  }
}
