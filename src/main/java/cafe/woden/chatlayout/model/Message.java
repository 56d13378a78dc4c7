package cafe.woden.chatlayout.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One message in a thread.
 *
 * <p>Messages are never edited in place. An edit is a new {@code Message} with the same {@link
 * #id()}; the two compare unequal and carry different {@link #contentFingerprint()} values.
 */
@ValueObject
public record Message(String id, Sender sender, Instant sentAt, MessageKind kind) {

  public Message {
    id = Objects.toString(id, "").trim();
    if (id.isEmpty()) throw new IllegalArgumentException("message id is blank");
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(kind, "kind");
    if (sentAt == null) sentAt = Instant.EPOCH;
  }

  public Message(String id, Sender sender, MessageKind kind) {
    this(id, sender, Instant.EPOCH, kind);
  }

  public static Message text(String id, Sender sender, String text) {
    return new Message(id, sender, new MessageKind.Text(text));
  }

  /** Hash over the whole value. Identity alone is {@link #id()}. */
  public int contentFingerprint() {
    return Objects.hash(id, sender, sentAt, kind);
  }

  /** Content equality: same id and same full value. */
  public boolean sameContentAs(Message other) {
    if (other == null) return false;
    if (contentFingerprint() != other.contentFingerprint()) return false;
    return equals(other);
  }
}
