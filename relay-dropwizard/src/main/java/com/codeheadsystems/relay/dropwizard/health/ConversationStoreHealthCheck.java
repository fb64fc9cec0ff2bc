package com.codeheadsystems.relay.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.relay.server.store.ConversationStore;

/**
 * Health check that verifies the conversation store can serve requests.
 */
public class ConversationStoreHealthCheck extends HealthCheck {

  private final ConversationStore store;

  /**
   * Instantiates a new Conversation store health check.
   *
   * @param store the store
   */
  public ConversationStoreHealthCheck(ConversationStore store) {
    this.store = store;
  }

  @Override
  protected Result check() {
    if (!store.isAvailable()) {
      return Result.unhealthy("Conversation store is not reachable");
    }
    return Result.healthy("conversations=%d", store.conversationCount());
  }
}
