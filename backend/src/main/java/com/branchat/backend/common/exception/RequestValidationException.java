package com.branchat.backend.common.exception;

/** Malformed input rejected before any side effect took place. */
public class RequestValidationException extends RuntimeException {

  public RequestValidationException(String message) {
    super(message);
  }
}
