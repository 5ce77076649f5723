package com.codeheadsystems.glance.server.tool;

/**
 * A tool was called with a missing or mistyped argument.
 */
public class InvalidToolArgumentException extends RuntimeException {

  public InvalidToolArgumentException(String message) {
    super(message);
  }
}
