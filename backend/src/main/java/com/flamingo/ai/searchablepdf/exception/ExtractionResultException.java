package com.flamingo.ai.searchablepdf.exception;

/** Exception thrown when the OCR provider's word-box response is unreadable or unsuccessful. */
public class ExtractionResultException extends TextLayerException {

  public ExtractionResultException(String message) {
    super(
        TextLayerErrorCode.EXTRACTION_RESULT_INVALID,
        message,
        "No usable text was recognized in the document");
  }

  public ExtractionResultException(String message, Throwable cause) {
    super(
        TextLayerErrorCode.EXTRACTION_RESULT_INVALID,
        message,
        "No usable text was recognized in the document",
        cause);
  }
}
