package com.codeheadsystems.relay.server.presence;

import java.util.Optional;

/**
 * Maps the presence key of an online identity (its email) to its live connection.
 * <p>
 * Implementations must be thread-safe and every operation on a single key must be
 * linearizable. Lookups are always by exact key.
 */
public interface PresenceDirectory {

  /**
   * Inserts or replaces the entry for a key.
   *
   * @param key    presence key
   * @param handle the live connection
   * @return the handle that was replaced, if any
   */
  Optional<ConnectionHandle> bind(String key, ConnectionHandle handle);

  /**
   * Inserts an entry only when the key has none.
   *
   * @param key    presence key
   * @param handle the live connection
   * @return the handle already bound, or empty if {@code handle} was inserted
   */
  Optional<ConnectionHandle> bindIfAbsent(String key, ConnectionHandle handle);

  /**
   * Replaces the entry only when it currently points at {@code expected}.
   *
   * @param key      presence key
   * @param expected handle that must currently be bound
   * @param handle   replacement
   * @return whether the entry was replaced
   */
  boolean replace(String key, ConnectionHandle expected, ConnectionHandle handle);

  /**
   * Exact-match lookup.
   *
   * @param key presence key
   * @return the live connection, or empty when the key is offline
   */
  Optional<ConnectionHandle> lookup(String key);

  /**
   * Removes the entry only when it currently points at {@code expected}; otherwise no-op.
   *
   * @param key      presence key
   * @param expected handle that must currently be bound
   * @return whether an entry was removed
   */
  boolean unbind(String key, ConnectionHandle expected);

  /**
   * Number of identities currently present.
   *
   * @return the count
   */
  int size();
}
