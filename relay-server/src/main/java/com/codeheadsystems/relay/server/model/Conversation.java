package com.codeheadsystems.relay.server.model;

import java.time.Instant;

/**
 * A durable one-to-one conversation.
 *
 * @param id            conversation id
 * @param participants  the two participants; exactly one conversation exists per pair
 * @param lastMessageId id of the most recently stored message, null while empty
 * @param messageCount  number of messages stored; also the sequence of the last message
 * @param createdAt     creation time
 * @param updatedAt     time of the last change
 */
public record Conversation(String id,
                           ParticipantPair participants,
                           String lastMessageId,
                           long messageCount,
                           Instant createdAt,
                           Instant updatedAt) {
}
