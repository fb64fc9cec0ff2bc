package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code send_message} frame.
 * <p>
 * Older clients name the recipient {@code toEmail}; both spellings are accepted.
 *
 * @param recipientKey email of the recipient
 * @param content      message text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SendMessageRequest(
    @JsonProperty("toEmail") @JsonAlias("recipientKey") String recipientKey,
    @JsonProperty("content") String content) {
}
