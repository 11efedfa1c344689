package com.flamingo.ai.searchablepdf.exception;

/** Exception thrown when the input PDF has no pages. */
public class EmptyDocumentException extends TextLayerException {

  public EmptyDocumentException() {
    super(
        TextLayerErrorCode.EMPTY_DOCUMENT,
        "Input document has zero pages",
        "The uploaded PDF does not contain any pages");
  }
}
