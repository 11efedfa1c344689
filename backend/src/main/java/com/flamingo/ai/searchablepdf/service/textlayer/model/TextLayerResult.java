package com.flamingo.ai.searchablepdf.service.textlayer.model;

import java.util.List;

/**
 * The searchable document plus a report of what could not be embedded.
 *
 * @param document serialized output PDF
 * @param pageCount number of pages in the output, always equal to the input's
 * @param embeddedPages pages that received an invisible layer
 * @param warnings skipped words and skipped page layers, ordered by page
 */
public record TextLayerResult(
    byte[] document, int pageCount, int embeddedPages, List<EmbeddingWarning> warnings) {

  public TextLayerResult {
    warnings = List.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  public List<EmbeddingWarning> warningsForPage(int pageIndex) {
    return warnings.stream().filter(w -> w.pageIndex() == pageIndex).toList();
  }
}
