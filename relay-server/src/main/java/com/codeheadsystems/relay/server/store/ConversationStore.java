package com.codeheadsystems.relay.server.store;

import com.codeheadsystems.relay.server.model.Conversation;
import com.codeheadsystems.relay.server.model.ConversationMessage;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for one-to-one conversations and their messages.
 * <p>
 * Conversations are keyed by the unordered pair of participant ids. Implementations must keep at
 * most one conversation per pair, even when both participants write the first message at once.
 * All methods may throw {@link ConversationStoreException}.
 */
public interface ConversationStore {

  /**
   * Returns the conversation between two users, creating it if it does not exist.
   *
   * @param userA one participant id
   * @param userB the other participant id
   * @return the conversation
   */
  Conversation findOrCreateConversation(String userA, String userB);

  /**
   * Stores a message in the conversation between sender and recipient as one unit of work:
   * find-or-create the conversation, append the message, advance the last-message pointer. Either
   * all of it is visible afterwards or none of it is.
   *
   * @param senderId    user id of the sender
   * @param recipientId user id of the recipient
   * @param content     message text
   * @return the stored message
   */
  ConversationMessage recordMessage(String senderId, String recipientId, String content);

  /**
   * Looks up the conversation between two users without creating it.
   *
   * @param userA one participant id
   * @param userB the other participant id
   * @return the conversation, if any
   */
  Optional<Conversation> findConversation(String userA, String userB);

  /**
   * The most recent messages of a conversation in ascending sequence order.
   *
   * @param conversationId the conversation
   * @param limit          maximum number of messages
   * @return the messages, oldest first
   */
  List<ConversationMessage> recentMessages(String conversationId, int limit);

  long conversationCount();

  long messageCount();

  /**
   * Cheap connectivity probe used by health checks.
   *
   * @return true when the store can serve requests
   */
  default boolean isAvailable() {
    return true;
  }
}
