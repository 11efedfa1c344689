package com.flamingo.ai.searchablepdf.service.textlayer.model;

/**
 * Geometry of a page as seen by the coordinate mapper.
 *
 * <p>The rectangle is the area the OCR raster covers, in unrotated PDF user space: normally the
 * crop box, or the placement of the scanned image when anchoring on it.
 *
 * @param pageIndex 0-based page index
 * @param x lower-left x of the reference rectangle
 * @param y lower-left y of the reference rectangle
 * @param width width in points before rotation
 * @param height height in points before rotation
 * @param rotation clockwise display rotation: 0, 90, 180 or 270
 */
public record PageGeometry(
    int pageIndex, float x, float y, float width, float height, int rotation) {

  public PageGeometry {
    rotation = normalizeRotation(rotation);
  }

  public static PageGeometry of(int pageIndex, float width, float height, int rotation) {
    return new PageGeometry(pageIndex, 0f, 0f, width, height, rotation);
  }

  /** Width of the page as a viewer displays it. */
  public float displayedWidth() {
    return isQuarterTurn() ? height : width;
  }

  /** Height of the page as a viewer displays it. */
  public float displayedHeight() {
    return isQuarterTurn() ? width : height;
  }

  private boolean isQuarterTurn() {
    return rotation == 90 || rotation == 270;
  }

  private static int normalizeRotation(int rotation) {
    int normalized = ((rotation % 360) + 360) % 360;
    return normalized % 90 == 0 ? normalized : 0;
  }
}
