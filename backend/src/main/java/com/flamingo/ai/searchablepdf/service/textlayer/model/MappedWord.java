package com.flamingo.ai.searchablepdf.service.textlayer.model;

/**
 * A recognized word placed in PDF user space.
 *
 * <p>{@code x} and {@code y} locate the lower-left corner of the box as the page is displayed,
 * expressed in unrotated user space. {@code width} runs along the displayed baseline, which points
 * {@code rotation} degrees counter-clockwise from the user-space x axis.
 *
 * @param text recognized text
 * @param pageIndex 0-based page index
 * @param x text origin x in points
 * @param y text origin y in points
 * @param width box extent along the baseline in points
 * @param height box extent perpendicular to the baseline in points
 * @param rotation baseline direction in degrees
 */
public record MappedWord(
    String text, int pageIndex, float x, float y, float width, float height, int rotation) {

  public boolean hasArea() {
    return width > 0 && height > 0;
  }
}
