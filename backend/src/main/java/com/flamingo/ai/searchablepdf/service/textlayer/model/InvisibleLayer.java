package com.flamingo.ai.searchablepdf.service.textlayer.model;

import java.util.List;

/**
 * Ordered text placements for one page.
 *
 * @param pageIndex 0-based page index
 * @param placements placements in OCR reading order
 */
public record InvisibleLayer(int pageIndex, List<TextPlacement> placements) {

  public InvisibleLayer {
    placements = List.copyOf(placements);
  }

  public boolean isEmpty() {
    return placements.isEmpty();
  }
}
