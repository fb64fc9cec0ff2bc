package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope for every WebSocket text message exchanged with the relay.
 * <p>
 * Example frames:
 * <pre>{@code
 *   {"event":"authenticate","data":"eyJhbGciOi..."}
 *   {"event":"send_message","data":{"toEmail":"b@x.com","content":"hi"}}
 *   {"event":"receive_message","data":{"from":"a@x.com","content":"hi"}}
 *   {"event":"error","data":"Recipient not online","kind":"RECIPIENT_OFFLINE"}
 * }</pre>
 *
 * @param event the event name, one of {@link EventNames}
 * @param data  the event payload; a string or a JSON object depending on the event
 * @param kind  the error kind, present on {@link EventNames#ERROR} and
 *              {@link EventNames#AUTH_ERROR} frames only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayFrame(
    @JsonProperty("event") String event,
    @JsonProperty("data") Object data,
    @JsonProperty("kind") RelayErrorKind kind) {

  /**
   * Creates a non-error frame.
   *
   * @param event the event name
   * @param data  the payload
   * @return the frame
   */
  public static RelayFrame of(String event, Object data) {
    return new RelayFrame(event, data, null);
  }

  /**
   * Creates a rejection frame. Authentication failures are reported as
   * {@link EventNames#AUTH_ERROR}, everything else as {@link EventNames#ERROR}.
   *
   * @param kind   what went wrong
   * @param reason human-readable reason
   * @return the frame
   */
  public static RelayFrame error(RelayErrorKind kind, String reason) {
    String event = kind == RelayErrorKind.AUTH_FAILURE ? EventNames.AUTH_ERROR : EventNames.ERROR;
    return new RelayFrame(event, reason, kind);
  }
}
