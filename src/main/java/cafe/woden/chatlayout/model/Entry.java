package cafe.woden.chatlayout.model;

import java.util.Objects;

/**
 * One renderable unit of a thread: a message, or the typing indicator.
 *
 * <p>{@link #key()} is identity (what moves, appears, disappears); {@link #sameContent} is the
 * stricter check used to detect in-place edits.
 */
public sealed interface Entry permits Entry.MessageEntry, Entry.TypingIndicator {

  /**
   * Identity of an entry. The typing indicator is told apart by kind, so a message may carry any
   * id, including the indicator's display id.
   */
  record Key(boolean typingIndicator, String id) {

    public static final Key TYPING_INDICATOR = new Key(true, "typingIndicator");

    public Key {
      Objects.requireNonNull(id, "id");
    }

    public static Key message(String id) {
      return new Key(false, id);
    }

    public boolean isMessage() {
      return !typingIndicator;
    }

    @Override
    public String toString() {
      return typingIndicator ? "<typing indicator>" : id;
    }
  }

  Key key();

  default String id() {
    return key().id();
  }

  boolean sameContent(Entry other);

  static Entry of(Message message) {
    return new MessageEntry(message);
  }

  static Entry typingIndicator() {
    return TypingIndicator.INSTANCE;
  }

  record MessageEntry(Message message) implements Entry {
    public MessageEntry {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public Key key() {
      return Key.message(message.id());
    }

    @Override
    public boolean sameContent(Entry other) {
      return other instanceof MessageEntry m && message.sameContentAs(m.message());
    }
  }

  final class TypingIndicator implements Entry {
    static final TypingIndicator INSTANCE = new TypingIndicator();

    private TypingIndicator() {}

    @Override
    public Key key() {
      return Key.TYPING_INDICATOR;
    }

    @Override
    public boolean sameContent(Entry other) {
      return other instanceof TypingIndicator;
    }

    @Override
    public String toString() {
      return "TypingIndicator";
    }
  }
}
