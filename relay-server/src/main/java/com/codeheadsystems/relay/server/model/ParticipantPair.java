package com.codeheadsystems.relay.server.model;

import java.util.Objects;

/**
 * The unordered pair of user ids that identifies a one-to-one conversation.
 * <p>
 * Always normalized so that {@code low <= high}; {@code (a, b)} and {@code (b, a)} produce equal
 * pairs. A self-conversation has {@code low == high}.
 *
 * @param low  the lexically smaller id
 * @param high the lexically larger id
 */
public record ParticipantPair(String low, String high) {

  public ParticipantPair {
    Objects.requireNonNull(low, "low");
    Objects.requireNonNull(high, "high");
    if (low.compareTo(high) > 0) {
      throw new IllegalArgumentException("ParticipantPair must be normalized; use ParticipantPair.of");
    }
  }

  /**
   * Normalizing factory.
   *
   * @param a one participant
   * @param b the other participant
   * @return the pair
   */
  public static ParticipantPair of(String a, String b) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    return a.compareTo(b) <= 0 ? new ParticipantPair(a, b) : new ParticipantPair(b, a);
  }
}
