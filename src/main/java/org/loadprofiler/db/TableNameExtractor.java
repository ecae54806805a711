package org.loadprofiler.db;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Best-effort keyword scan for the tables a statement touches. Not a SQL parser. */
public final class TableNameExtractor {

  private static final List<Pattern> TABLE_PATTERNS =
      List.of(
          Pattern.compile("\\bfrom\\s+([\\w.\"`\\[\\]]+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bjoin\\s+([\\w.\"`\\[\\]]+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*update\\s+([\\w.\"`\\[\\]]+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\binsert\\s+into\\s+([\\w.\"`\\[\\]]+)", Pattern.CASE_INSENSITIVE));

  private TableNameExtractor() {}

  public static List<String> extract(String sql) {
    if (sql == null || sql.isBlank()) {
      return List.of();
    }
    Set<String> tables = new LinkedHashSet<>();
    for (Pattern pattern : TABLE_PATTERNS) {
      Matcher matcher = pattern.matcher(sql);
      while (matcher.find()) {
        String table = matcher.group(1).replaceAll("[\"`\\[\\]]", "");
        if (!table.isEmpty()) {
          tables.add(table);
        }
      }
    }
    return List.copyOf(tables);
  }
}
