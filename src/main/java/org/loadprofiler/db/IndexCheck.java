package org.loadprofiler.db;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/** An index expected to exist for a known query shape. */
@Getter
@Builder
@Jacksonized
@ToString
public class IndexCheck {
  private final String table;
  private final List<String> columns;
  @Builder.Default private final List<String> queryPatterns = List.of();
  private final String recommendation;

  public static List<IndexCheck> defaultChecklist() {
    return List.of(
        IndexCheck.builder()
            .table("test_documents")
            .columns(List.of("created_at", "category"))
            .queryPatterns(List.of("WHERE created_at > ? AND category = ?"))
            .recommendation("Composite index for date range and category filtering")
            .build(),
        IndexCheck.builder()
            .table("test_history")
            .columns(List.of("document_id", "timestamp"))
            .queryPatterns(List.of("WHERE document_id = ? ORDER BY timestamp"))
            .recommendation("Composite index for document history queries")
            .build());
  }
}
