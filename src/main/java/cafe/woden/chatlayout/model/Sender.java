package cafe.woden.chatlayout.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** The author of a message. Identity is {@code senderId}; the display name is cosmetic. */
@ValueObject
public record Sender(String senderId, String displayName) {

  public Sender {
    senderId = Objects.toString(senderId, "").trim();
    if (senderId.isEmpty()) throw new IllegalArgumentException("senderId is blank");
    if (displayName == null || displayName.isBlank()) displayName = senderId;
  }

  public Sender(String senderId) {
    this(senderId, senderId);
  }
}
