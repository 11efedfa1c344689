package com.flamingo.ai.searchablepdf.service.textlayer.model;

import java.util.List;

/**
 * Outcome of building one page's layer on the worker pool.
 *
 * @param pageIndex 0-based page index
 * @param layer the built layer, or {@code null} when the page was skipped as a whole
 * @param warnings recovered failures for this page
 */
public record PageLayerResult(int pageIndex, InvisibleLayer layer, List<EmbeddingWarning> warnings) {

  public PageLayerResult {
    warnings = List.copyOf(warnings);
  }

  public static PageLayerResult skipped(int pageIndex, EmbeddingWarning warning) {
    return new PageLayerResult(pageIndex, null, List.of(warning));
  }

  public boolean hasPlacements() {
    return layer != null && !layer.isEmpty();
  }
}
