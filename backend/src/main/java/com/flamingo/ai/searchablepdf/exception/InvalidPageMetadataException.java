package com.flamingo.ai.searchablepdf.exception;

/** Exception thrown when the OCR pixel dimensions of a page are zero or negative. */
public class InvalidPageMetadataException extends TextLayerException {

  private final int pageIndex;

  public InvalidPageMetadataException(int pageIndex, double pixelWidth, double pixelHeight) {
    super(
        TextLayerErrorCode.INVALID_PAGE_METADATA,
        String.format(
            "Page %d has invalid OCR pixel dimensions %sx%s", pageIndex, pixelWidth, pixelHeight),
        "The recognized text for this page has unusable page dimensions");
    this.pageIndex = pageIndex;
  }

  public int getPageIndex() {
    return pageIndex;
  }
}
