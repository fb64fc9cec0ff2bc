package com.codeheadsystems.relay.server.presence;

import com.codeheadsystems.relay.model.RelayFrame;
import java.io.IOException;

/**
 * Outbound side of one live transport session.
 * <p>
 * Implementations must serialize concurrent {@link #send} calls; frames for one session may be
 * produced by several threads at once (its own requests and messages routed to it).
 */
public interface EventSink {

  /**
   * Writes a frame to the client.
   *
   * @param frame the frame
   * @throws IOException if the session is closed or the write fails
   */
  void send(RelayFrame frame) throws IOException;

  /**
   * Closes the underlying session. Closing an already closed session is a no-op.
   *
   * @param reason reason reported to the client where the transport supports it
   */
  void close(String reason);
}
