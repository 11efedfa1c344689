package com.flamingo.ai.searchablepdf.service.textlayer.model;

import java.util.List;

/**
 * OCR output for one page: the words in provider reading order plus the raster they refer to.
 *
 * @param words recognized words, in the order the provider produced them
 * @param meta pixel dimensions of the OCR raster
 */
public record PageWords(List<RecognizedWord> words, PageImageMeta meta) {

  public PageWords {
    words = words == null ? List.of() : List.copyOf(words);
  }
}
