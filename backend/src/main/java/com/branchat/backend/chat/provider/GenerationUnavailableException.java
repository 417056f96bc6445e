package com.branchat.backend.chat.provider;

/** The generation provider produced no usable response for a primary request. */
public class GenerationUnavailableException extends RuntimeException {

  public GenerationUnavailableException(String message) {
    super(message);
  }

  public GenerationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
