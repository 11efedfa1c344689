package com.flamingo.ai.searchablepdf.service.textlayer.model;

/**
 * Immutable settings for one embedding run.
 *
 * @param calibration font size per point of box height
 * @param minFontSize lower clamp for derived font sizes
 * @param maxFontSize upper clamp for derived font sizes
 * @param minHorizontalScale lower bound for the horizontal scale ratio
 * @param anchor rectangle the OCR pixel space maps onto
 * @param strict fail the whole document on a page whose structure cannot be appended to
 * @param fontResourcePrefix preferred resource name of the layer font
 * @param compress flate-compress appended content streams
 * @param parallel build page layers on the worker pool
 */
public record EmbeddingOptions(
    float calibration,
    float minFontSize,
    float maxFontSize,
    float minHorizontalScale,
    AnchorMode anchor,
    boolean strict,
    String fontResourcePrefix,
    boolean compress,
    boolean parallel) {

  public static EmbeddingOptions defaults() {
    return new EmbeddingOptions(
        0.85f, 4.0f, 72.0f, 0.01f, AnchorMode.CROP_BOX, false, "OcrF", true, true);
  }

  public EmbeddingOptions withStrict(boolean strict) {
    return new EmbeddingOptions(
        calibration,
        minFontSize,
        maxFontSize,
        minHorizontalScale,
        anchor,
        strict,
        fontResourcePrefix,
        compress,
        parallel);
  }

  public EmbeddingOptions withAnchor(AnchorMode anchor) {
    return new EmbeddingOptions(
        calibration,
        minFontSize,
        maxFontSize,
        minHorizontalScale,
        anchor,
        strict,
        fontResourcePrefix,
        compress,
        parallel);
  }

  public EmbeddingOptions withParallel(boolean parallel) {
    return new EmbeddingOptions(
        calibration,
        minFontSize,
        maxFontSize,
        minHorizontalScale,
        anchor,
        strict,
        fontResourcePrefix,
        compress,
        parallel);
  }
}
