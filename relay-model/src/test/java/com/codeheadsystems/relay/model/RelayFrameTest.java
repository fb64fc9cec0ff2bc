package com.codeheadsystems.relay.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RelayFrameTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void error_authFailureUsesAuthErrorEvent() {
    RelayFrame frame = RelayFrame.error(RelayErrorKind.AUTH_FAILURE, "Invalid or expired token");

    assertThat(frame.event()).isEqualTo(EventNames.AUTH_ERROR);
    assertThat(frame.data()).isEqualTo("Invalid or expired token");
  }

  @Test
  void error_otherKindsUseErrorEvent() {
    RelayFrame frame = RelayFrame.error(RelayErrorKind.RECIPIENT_OFFLINE, "Recipient not online");

    assertThat(frame.event()).isEqualTo(EventNames.ERROR);
    assertThat(frame.kind()).isEqualTo(RelayErrorKind.RECIPIENT_OFFLINE);
  }

  @Test
  void serialize_omitsKindOnRegularFrames() throws Exception {
    String json = objectMapper.writeValueAsString(
        RelayFrame.of(EventNames.RECEIVE_MESSAGE, new ReceivedMessage("a@x.com", "hi")));

    assertThat(json).isEqualTo(
        "{\"event\":\"receive_message\",\"data\":{\"from\":\"a@x.com\",\"content\":\"hi\"}}");
  }

  @Test
  void deserialize_objectPayloadBecomesMap() throws Exception {
    RelayFrame frame = objectMapper.readValue(
        "{\"event\":\"send_message\",\"data\":{\"toEmail\":\"b@x.com\",\"content\":\"hi\"}}",
        RelayFrame.class);

    assertThat(frame.event()).isEqualTo(EventNames.SEND_MESSAGE);
    assertThat(frame.data()).isInstanceOf(Map.class);
    assertThat(frame.kind()).isNull();
  }
}
