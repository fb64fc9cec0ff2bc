package com.codeheadsystems.relay.server.store;

import com.codeheadsystems.relay.server.model.Conversation;
import com.codeheadsystems.relay.server.model.ConversationMessage;
import com.codeheadsystems.relay.server.model.ParticipantPair;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ConversationStore}.
 * <p>
 * A single lock serializes writes, which makes each {@link #recordMessage} atomic and keeps one
 * conversation per participant pair. All history is lost on server restart. Suitable for
 * development and integration testing only.
 */
public class InMemoryConversationStore implements ConversationStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);

  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<ParticipantPair, Conversation> conversations = new HashMap<>();
  private final Map<String, List<ConversationMessage>> messages = new HashMap<>();

  public InMemoryConversationStore() {
    this(Clock.systemUTC());
  }

  public InMemoryConversationStore(Clock clock) {
    this.clock = clock;
    log.warn("InMemoryConversationStore in use: conversation history is lost on restart");
  }

  @Override
  public Conversation findOrCreateConversation(String userA, String userB) {
    lock.lock();
    try {
      return findOrCreate(ParticipantPair.of(userA, userB));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ConversationMessage recordMessage(String senderId, String recipientId, String content) {
    lock.lock();
    try {
      Conversation conversation = findOrCreate(ParticipantPair.of(senderId, recipientId));
      Instant now = clock.instant();
      long sequence = conversation.messageCount() + 1;
      ConversationMessage message = new ConversationMessage(UUID.randomUUID().toString(),
          conversation.id(), senderId, content, sequence, now);
      messages.computeIfAbsent(conversation.id(), k -> new ArrayList<>()).add(message);
      conversations.put(conversation.participants(), new Conversation(conversation.id(),
          conversation.participants(), message.id(), sequence, conversation.createdAt(), now));
      log.debug("Recorded message seq={} in conversation {}", sequence, conversation.id());
      return message;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<Conversation> findConversation(String userA, String userB) {
    lock.lock();
    try {
      return Optional.ofNullable(conversations.get(ParticipantPair.of(userA, userB)));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<ConversationMessage> recentMessages(String conversationId, int limit) {
    lock.lock();
    try {
      List<ConversationMessage> all = messages.getOrDefault(conversationId, List.of());
      int from = Math.max(0, all.size() - Math.max(0, limit));
      return List.copyOf(all.subList(from, all.size()));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long conversationCount() {
    lock.lock();
    try {
      return conversations.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long messageCount() {
    lock.lock();
    try {
      return messages.values().stream().mapToLong(List::size).sum();
    } finally {
      lock.unlock();
    }
  }

  private Conversation findOrCreate(ParticipantPair pair) {
    return conversations.computeIfAbsent(pair, p -> {
      Instant now = clock.instant();
      Conversation created = new Conversation(UUID.randomUUID().toString(), p, null, 0, now, now);
      log.debug("Created conversation {}", created.id());
      return created;
    });
  }
}
