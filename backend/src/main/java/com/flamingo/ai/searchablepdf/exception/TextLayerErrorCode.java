package com.flamingo.ai.searchablepdf.exception;

/** Machine-readable codes for failures and warnings raised while embedding a text layer. */
public enum TextLayerErrorCode {
  INVALID_PAGE_METADATA,
  UNSUPPORTED_PAGE_STRUCTURE,
  EMPTY_DOCUMENT,
  MALFORMED_INPUT,
  LAYER_CONSTRUCTION_FAILED,

  /** Word dropped because its text is blank or its mapped box has no area. */
  DEGENERATE_WORD,

  EXTRACTION_RESULT_INVALID
}
