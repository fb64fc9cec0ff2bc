package com.codeheadsystems.relay.server.presence;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PresenceDirectory} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Each operation maps onto one atomic map operation, which gives per-key linearizability.
 * Handles are compared by reference. Presence is process-local and lost on restart.
 */
public class InMemoryPresenceDirectory implements PresenceDirectory {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPresenceDirectory.class);

  private final ConcurrentHashMap<String, ConnectionHandle> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<ConnectionHandle> bind(String key, ConnectionHandle handle) {
    ConnectionHandle previous = entries.put(key, handle);
    log.debug("bind({}, {}) replaced={}", key, handle, previous);
    return Optional.ofNullable(previous);
  }

  @Override
  public Optional<ConnectionHandle> bindIfAbsent(String key, ConnectionHandle handle) {
    return Optional.ofNullable(entries.putIfAbsent(key, handle));
  }

  @Override
  public boolean replace(String key, ConnectionHandle expected, ConnectionHandle handle) {
    return entries.replace(key, expected, handle);
  }

  @Override
  public Optional<ConnectionHandle> lookup(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public boolean unbind(String key, ConnectionHandle expected) {
    boolean removed = entries.remove(key, expected);
    if (!removed) {
      log.debug("unbind({}, {}) discarded: entry points elsewhere", key, expected);
    }
    return removed;
  }

  @Override
  public int size() {
    return entries.size();
  }
}
