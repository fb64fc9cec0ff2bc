package com.codeheadsystems.relay.server.manager;

/**
 * What happens when an identity authenticates while another connection is already present
 * under the same key.
 */
public enum DuplicateSessionPolicy {

  /**
   * Last bind wins. The older connection stays open but no longer receives messages.
   */
  REPLACE,

  /**
   * The new authentication fails with {@code AUTH_FAILURE}; the existing connection is kept.
   */
  REJECT,

  /**
   * Last bind wins and the older connection is closed.
   */
  EVICT
}
