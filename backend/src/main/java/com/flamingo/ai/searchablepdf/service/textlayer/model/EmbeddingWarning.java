package com.flamingo.ai.searchablepdf.service.textlayer.model;

import com.flamingo.ai.searchablepdf.exception.TextLayerErrorCode;

/**
 * A recovered failure: a skipped word or a skipped page layer.
 *
 * @param pageIndex 0-based page index
 * @param wordIndex index of the word within the page's OCR list, or {@code null} for page-level
 *     warnings
 * @param code failure category
 * @param message human-readable detail
 */
public record EmbeddingWarning(
    int pageIndex, Integer wordIndex, TextLayerErrorCode code, String message) {

  public static EmbeddingWarning forPage(int pageIndex, TextLayerErrorCode code, String message) {
    return new EmbeddingWarning(pageIndex, null, code, message);
  }

  public static EmbeddingWarning forWord(
      int pageIndex, int wordIndex, TextLayerErrorCode code, String message) {
    return new EmbeddingWarning(pageIndex, wordIndex, code, message);
  }

  public boolean isPageLevel() {
    return wordIndex == null;
  }
}
