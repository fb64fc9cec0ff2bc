package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code receive_message} frame delivered to the recipient.
 *
 * @param from    email of the sender
 * @param content message text
 */
public record ReceivedMessage(
    @JsonProperty("from") String from,
    @JsonProperty("content") String content) {
}
