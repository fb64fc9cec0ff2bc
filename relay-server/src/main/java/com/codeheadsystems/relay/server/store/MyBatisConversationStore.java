package com.codeheadsystems.relay.server.store;

import com.codeheadsystems.relay.server.model.Conversation;
import com.codeheadsystems.relay.server.model.ConversationMessage;
import com.codeheadsystems.relay.server.model.ParticipantPair;
import com.codeheadsystems.relay.server.store.mapper.ConversationMapper;
import com.codeheadsystems.relay.server.store.mapper.ConversationRow;
import com.codeheadsystems.relay.server.store.mapper.MessageRow;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import javax.sql.DataSource;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConversationStore} backed by a relational database through MyBatis.
 * <p>
 * Each {@link #recordMessage} runs in a single transaction. The unique constraint on the
 * participant pair keeps one conversation per pair; a writer that loses the creation race rolls
 * back and retries, finding the winner's row. Works against PostgreSQL and H2.
 */
public class MyBatisConversationStore implements ConversationStore {

  private static final Logger log = LoggerFactory.getLogger(MyBatisConversationStore.class);

  private static final int MAX_ATTEMPTS = 3;
  private static final String INTEGRITY_VIOLATION_CLASS = "23";

  private final SqlSessionFactory sessionFactory;
  private final Clock clock;

  public MyBatisConversationStore(DataSource dataSource) {
    this(dataSource, Clock.systemUTC());
  }

  public MyBatisConversationStore(DataSource dataSource, Clock clock) {
    Environment environment = new Environment("relay", new JdbcTransactionFactory(), dataSource);
    Configuration configuration = new Configuration(environment);
    configuration.setMapUnderscoreToCamelCase(true);
    configuration.addMapper(ConversationMapper.class);
    this.sessionFactory = new SqlSessionFactoryBuilder().build(configuration);
    this.clock = clock;
  }

  /**
   * Creates the tables when they do not exist yet.
   */
  public void createSchema() {
    inTransaction(mapper -> {
      mapper.createConversationsTable();
      mapper.createMessagesTable();
      return null;
    });
    log.info("Conversation schema ready");
  }

  @Override
  public Conversation findOrCreateConversation(String userA, String userB) {
    ParticipantPair pair = ParticipantPair.of(userA, userB);
    return inTransaction(mapper -> toConversation(findOrInsert(mapper, pair)));
  }

  @Override
  public ConversationMessage recordMessage(String senderId, String recipientId, String content) {
    ParticipantPair pair = ParticipantPair.of(senderId, recipientId);
    return inTransaction(mapper -> {
      ConversationRow conversation = findOrInsert(mapper, pair);
      Instant now = clock.instant();
      if (mapper.incrementMessageCount(conversation.getId(), now) != 1) {
        throw new ConversationStoreException("Conversation vanished: " + conversation.getId());
      }
      long sequence = mapper.selectById(conversation.getId()).getMessageCount();

      MessageRow row = new MessageRow();
      row.setId(UUID.randomUUID().toString());
      row.setConversationId(conversation.getId());
      row.setSenderId(senderId);
      row.setContent(content);
      row.setSeq(sequence);
      row.setCreatedAt(now);
      mapper.insertMessage(row);
      mapper.updateLastMessage(conversation.getId(), row.getId());
      log.debug("Recorded message seq={} in conversation {}", sequence, conversation.getId());
      return toMessage(row);
    });
  }

  @Override
  public Optional<Conversation> findConversation(String userA, String userB) {
    ParticipantPair pair = ParticipantPair.of(userA, userB);
    return inTransaction(mapper ->
        Optional.ofNullable(mapper.selectByParticipants(pair.low(), pair.high()))
            .map(this::toConversation));
  }

  @Override
  public List<ConversationMessage> recentMessages(String conversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return inTransaction(mapper -> {
      List<ConversationMessage> result = new ArrayList<>();
      for (MessageRow row : mapper.selectLatest(conversationId, limit)) {
        result.add(toMessage(row));
      }
      Collections.reverse(result);
      return result;
    });
  }

  @Override
  public long conversationCount() {
    return inTransaction(ConversationMapper::countConversations);
  }

  @Override
  public long messageCount() {
    return inTransaction(ConversationMapper::countMessages);
  }

  @Override
  public boolean isAvailable() {
    try {
      return Integer.valueOf(1).equals(inTransaction(ConversationMapper::ping));
    } catch (ConversationStoreException e) {
      log.warn("Conversation store unavailable: {}", e.getMessage());
      return false;
    }
  }

  // ── Internals ─────────────────────────────────────────────────────────────

  private ConversationRow findOrInsert(ConversationMapper mapper, ParticipantPair pair) {
    ConversationRow existing = mapper.selectByParticipants(pair.low(), pair.high());
    if (existing != null) {
      return existing;
    }
    Instant now = clock.instant();
    ConversationRow row = new ConversationRow();
    row.setId(UUID.randomUUID().toString());
    row.setParticipantLow(pair.low());
    row.setParticipantHigh(pair.high());
    row.setMessageCount(0);
    row.setCreatedAt(now);
    row.setUpdatedAt(now);
    mapper.insertConversation(row);
    log.debug("Created conversation {}", row.getId());
    return row;
  }

  /**
   * Runs the work in one transaction, committing on success and rolling back on any failure.
   * Integrity violations are retried from scratch.
   */
  private <T> T inTransaction(Function<ConversationMapper, T> work) {
    PersistenceException last = null;
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      try (SqlSession session = sessionFactory.openSession(false)) {
        try {
          T result = work.apply(session.getMapper(ConversationMapper.class));
          session.commit(true);
          return result;
        } catch (RuntimeException e) {
          session.rollback(true);
          throw e;
        }
      } catch (PersistenceException e) {
        if (!isIntegrityViolation(e)) {
          throw new ConversationStoreException("Conversation store failure", e);
        }
        log.debug("Integrity violation on attempt {}, retrying", attempt);
        last = e;
      }
    }
    throw new ConversationStoreException("Conversation store failure after retries", last);
  }

  private static boolean isIntegrityViolation(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql
          && sql.getSQLState() != null
          && sql.getSQLState().startsWith(INTEGRITY_VIOLATION_CLASS)) {
        return true;
      }
    }
    return false;
  }

  private Conversation toConversation(ConversationRow row) {
    return new Conversation(row.getId(),
        new ParticipantPair(row.getParticipantLow(), row.getParticipantHigh()),
        row.getLastMessageId(), row.getMessageCount(), row.getCreatedAt(), row.getUpdatedAt());
  }

  private ConversationMessage toMessage(MessageRow row) {
    return new ConversationMessage(row.getId(), row.getConversationId(), row.getSenderId(),
        row.getContent(), row.getSeq(), row.getCreatedAt());
  }
}
