package com.codeheadsystems.relay.server.model;

import java.time.Instant;

/**
 * A stored message. Sequences within a conversation start at 1 and increase by one per message.
 *
 * @param id             message id
 * @param conversationId owning conversation
 * @param senderId       user id of the sender
 * @param content        message text
 * @param sequence       position in the conversation
 * @param createdAt      time the message was stored
 */
public record ConversationMessage(String id,
                                  String conversationId,
                                  String senderId,
                                  String content,
                                  long sequence,
                                  Instant createdAt) {
}
