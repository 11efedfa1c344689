package com.flamingo.ai.searchablepdf.exception;

/** Exception thrown when the input bytes cannot be parsed as a PDF at all. */
public class MalformedInputException extends TextLayerException {

  public MalformedInputException(String message) {
    super(TextLayerErrorCode.MALFORMED_INPUT, message, "The uploaded file is not a readable PDF");
  }

  public MalformedInputException(String message, Throwable cause) {
    super(
        TextLayerErrorCode.MALFORMED_INPUT,
        message,
        "The uploaded file is not a readable PDF",
        cause);
  }
}
