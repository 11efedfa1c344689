package com.flamingo.ai.searchablepdf.exception;

/** Exception thrown when a page's content cannot be appended to without side effects. */
public class UnsupportedPageStructureException extends TextLayerException {

  private final int pageIndex;

  public UnsupportedPageStructureException(int pageIndex, String reason) {
    super(
        TextLayerErrorCode.UNSUPPORTED_PAGE_STRUCTURE,
        "Page " + pageIndex + " cannot take a text layer: " + reason,
        "A page of this document has a structure that cannot be made searchable");
    this.pageIndex = pageIndex;
  }

  public int getPageIndex() {
    return pageIndex;
  }
}
