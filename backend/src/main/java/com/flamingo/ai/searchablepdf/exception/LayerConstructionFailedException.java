package com.flamingo.ai.searchablepdf.exception;

/**
 * Exception thrown for unexpected failures while building or writing an invisible text layer,
 * such as a glyph the built-in font cannot encode.
 */
public class LayerConstructionFailedException extends TextLayerException {

  private final int pageIndex;

  public LayerConstructionFailedException(int pageIndex, String message, Throwable cause) {
    super(
        TextLayerErrorCode.LAYER_CONSTRUCTION_FAILED,
        message,
        "Part of the recognized text could not be embedded",
        cause);
    this.pageIndex = pageIndex;
  }

  public int getPageIndex() {
    return pageIndex;
  }
}
