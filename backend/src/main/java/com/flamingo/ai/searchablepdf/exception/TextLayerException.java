package com.flamingo.ai.searchablepdf.exception;

/** Base type for all failures raised by the text-layer embedding core. */
public abstract class TextLayerException extends RuntimeException {

  private final TextLayerErrorCode code;
  private final String userMessage;

  protected TextLayerException(TextLayerErrorCode code, String message, String userMessage) {
    super(message);
    this.code = code;
    this.userMessage = userMessage;
  }

  protected TextLayerException(
      TextLayerErrorCode code, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.userMessage = userMessage;
  }

  public TextLayerErrorCode getCode() {
    return code;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
