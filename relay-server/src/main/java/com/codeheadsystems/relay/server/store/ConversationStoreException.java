package com.codeheadsystems.relay.server.store;

/**
 * The conversation store could not complete an operation. Any partial write has been rolled
 * back.
 */
public class ConversationStoreException extends RuntimeException {

  public ConversationStoreException(final String message) {
    super(message);
  }

  public ConversationStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
