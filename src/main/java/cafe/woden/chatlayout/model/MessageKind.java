package cafe.woden.chatlayout.model;

import java.util.Objects;

/**
 * What a message carries. Closed set; layout picks a size calculator by {@link #type()}.
 */
public sealed interface MessageKind
    permits MessageKind.Text,
        MessageKind.AttributedText,
        MessageKind.Emoji,
        MessageKind.Photo,
        MessageKind.Video,
        MessageKind.Audio,
        MessageKind.Location,
        MessageKind.Contact,
        MessageKind.LinkPreview,
        MessageKind.Custom,
        MessageKind.System {

  enum Type {
    TEXT,
    ATTRIBUTED_TEXT,
    EMOJI,
    PHOTO,
    VIDEO,
    AUDIO,
    LOCATION,
    CONTACT,
    LINK_PREVIEW,
    CUSTOM,
    SYSTEM
  }

  Type type();

  record Text(String text) implements MessageKind {
    public Text {
      text = Objects.toString(text, "");
    }

    @Override
    public Type type() {
      return Type.TEXT;
    }
  }

  record AttributedText(StyledText text) implements MessageKind {
    public AttributedText {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public Type type() {
      return Type.ATTRIBUTED_TEXT;
    }
  }

  record Emoji(String text) implements MessageKind {
    public Emoji {
      text = Objects.toString(text, "");
    }

    @Override
    public Type type() {
      return Type.EMOJI;
    }
  }

  record Photo(MediaItem item) implements MessageKind {
    public Photo {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public Type type() {
      return Type.PHOTO;
    }
  }

  record Video(MediaItem item) implements MessageKind {
    public Video {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public Type type() {
      return Type.VIDEO;
    }
  }

  record Audio(AudioItem item) implements MessageKind {
    public Audio {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public Type type() {
      return Type.AUDIO;
    }
  }

  record Location(LocationItem item) implements MessageKind {
    public Location {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public Type type() {
      return Type.LOCATION;
    }
  }

  record Contact(ContactItem item) implements MessageKind {
    public Contact {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public Type type() {
      return Type.CONTACT;
    }
  }

  record LinkPreview(LinkItem link) implements MessageKind {
    public LinkPreview {
      Objects.requireNonNull(link, "link");
    }

    @Override
    public Type type() {
      return Type.LINK_PREVIEW;
    }
  }

  /** Host-defined content. The host must register a calculator for {@link Type#CUSTOM}. */
  record Custom(String customType, Object payload) implements MessageKind {
    public Custom {
      customType = Objects.toString(customType, "");
    }

    @Override
    public Type type() {
      return Type.CUSTOM;
    }
  }

  /** Non-interactive caption centered in the thread (joins, date changes, and the like). */
  record System(StyledText text) implements MessageKind {
    public System {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public Type type() {
      return Type.SYSTEM;
    }
  }
}
