package com.flamingo.ai.frontdesk.service.indexing;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Aggregate report of indexing every active business. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkIndexingResult {

  private int totalBusinesses;
  private int successful;
  private int failed;
  @Builder.Default private List<BusinessIndexingOutcome> details = new ArrayList<>();

  public boolean isSuccess() {
    return failed == 0;
  }
}
