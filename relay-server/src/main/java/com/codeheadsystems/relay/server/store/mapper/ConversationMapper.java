package com.codeheadsystems.relay.server.store.mapper;

import java.time.Instant;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * MyBatis mapper for the {@code conversations} and {@code messages} tables.
 * <p>
 * The SQL sticks to the subset shared by PostgreSQL and H2.
 */
public interface ConversationMapper {

  // ── Schema ────────────────────────────────────────────────────────────────

  @Update("CREATE TABLE IF NOT EXISTS conversations ("
      + " id VARCHAR(64) PRIMARY KEY,"
      + " participant_low VARCHAR(255) NOT NULL,"
      + " participant_high VARCHAR(255) NOT NULL,"
      + " last_message_id VARCHAR(64),"
      + " message_count BIGINT NOT NULL DEFAULT 0,"
      + " created_at TIMESTAMP NOT NULL,"
      + " updated_at TIMESTAMP NOT NULL,"
      + " CONSTRAINT uq_conversations_participants UNIQUE (participant_low, participant_high))")
  void createConversationsTable();

  @Update("CREATE TABLE IF NOT EXISTS messages ("
      + " id VARCHAR(64) PRIMARY KEY,"
      + " conversation_id VARCHAR(64) NOT NULL REFERENCES conversations (id),"
      + " sender_id VARCHAR(255) NOT NULL,"
      + " content VARCHAR(10000) NOT NULL,"
      + " seq BIGINT NOT NULL,"
      + " created_at TIMESTAMP NOT NULL,"
      + " CONSTRAINT uq_messages_conversation_seq UNIQUE (conversation_id, seq))")
  void createMessagesTable();

  // ── Conversations ─────────────────────────────────────────────────────────

  @Select("SELECT id, participant_low, participant_high, last_message_id, message_count,"
      + " created_at, updated_at FROM conversations"
      + " WHERE participant_low = #{low} AND participant_high = #{high}")
  ConversationRow selectByParticipants(@Param("low") String low, @Param("high") String high);

  @Select("SELECT id, participant_low, participant_high, last_message_id, message_count,"
      + " created_at, updated_at FROM conversations WHERE id = #{id}")
  ConversationRow selectById(@Param("id") String id);

  @Insert("INSERT INTO conversations (id, participant_low, participant_high, last_message_id,"
      + " message_count, created_at, updated_at) VALUES (#{id}, #{participantLow},"
      + " #{participantHigh}, #{lastMessageId,jdbcType=VARCHAR}, #{messageCount},"
      + " #{createdAt}, #{updatedAt})")
  int insertConversation(ConversationRow row);

  /**
   * Claims the next sequence number. The row lock taken here serializes concurrent appends to
   * the same conversation until the transaction ends.
   */
  @Update("UPDATE conversations SET message_count = message_count + 1, updated_at = #{now}"
      + " WHERE id = #{id}")
  int incrementMessageCount(@Param("id") String id, @Param("now") Instant now);

  @Update("UPDATE conversations SET last_message_id = #{messageId} WHERE id = #{id}")
  int updateLastMessage(@Param("id") String id, @Param("messageId") String messageId);

  @Select("SELECT COUNT(*) FROM conversations")
  long countConversations();

  // ── Messages ──────────────────────────────────────────────────────────────

  @Insert("INSERT INTO messages (id, conversation_id, sender_id, content, seq, created_at)"
      + " VALUES (#{id}, #{conversationId}, #{senderId}, #{content}, #{seq}, #{createdAt})")
  int insertMessage(MessageRow row);

  @Select("SELECT id, conversation_id, sender_id, content, seq, created_at FROM messages"
      + " WHERE conversation_id = #{conversationId} ORDER BY seq DESC LIMIT #{limit}")
  List<MessageRow> selectLatest(@Param("conversationId") String conversationId,
                                @Param("limit") int limit);

  @Select("SELECT COUNT(*) FROM messages")
  long countMessages();

  @Select("SELECT 1")
  Integer ping();
}
