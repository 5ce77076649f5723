package com.codeheadsystems.glance.server.accessor;

/**
 * Raised when a call to the Glance backend fails: transport error, timeout, non-2xx status or
 * an unreadable body.
 */
public class GlanceAccessorException extends RuntimeException {

  /**
   * Instantiates a new Glance accessor exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public GlanceAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
