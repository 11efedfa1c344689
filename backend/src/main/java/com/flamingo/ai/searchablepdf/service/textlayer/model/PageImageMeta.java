package com.flamingo.ai.searchablepdf.service.textlayer.model;

/**
 * Pixel dimensions of the raster the OCR provider computed word boxes against.
 *
 * <p>Providers reporting boxes as fractions of the page use {@link #normalized()}, a 1x1 pixel
 * space.
 *
 * @param pixelWidth width of the OCR raster in pixels
 * @param pixelHeight height of the OCR raster in pixels
 */
public record PageImageMeta(double pixelWidth, double pixelHeight) {

  private static final PageImageMeta NORMALIZED = new PageImageMeta(1.0, 1.0);

  public static PageImageMeta normalized() {
    return NORMALIZED;
  }

  public boolean isValid() {
    return pixelWidth > 0 && pixelHeight > 0 && Double.isFinite(pixelWidth)
        && Double.isFinite(pixelHeight);
  }
}
