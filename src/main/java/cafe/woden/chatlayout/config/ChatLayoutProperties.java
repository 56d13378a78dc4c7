package cafe.woden.chatlayout.config;

import cafe.woden.chatlayout.layout.AttributesCache;
import cafe.woden.chatlayout.layout.AvatarPosition;
import cafe.woden.chatlayout.layout.LayoutStyles;
import cafe.woden.chatlayout.layout.Size;
import cafe.woden.chatlayout.layout.SizingConfiguration;
import cafe.woden.chatlayout.memory.MemoryPressureMonitor;
import java.awt.Font;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Layout configuration.
 *
 * <p>Anything left out of {@code application.yml} falls back to the built-in bubble layout.
 */
@ConfigurationProperties(prefix = "chatlayout")
public record ChatLayoutProperties(
    Cache cache,
    Memory memory,
    Text text,
    Direction incoming,
    Direction outgoing,
    Integer avatarLeadingTrailingPadding,
    TypingIndicator typingIndicator) {

  /** Cached layout attributes, least recently used evicted first. */
  public record Cache(Integer maxEntries) {
    public Cache {
      if (maxEntries == null || maxEntries <= 0) maxEntries = AttributesCache.DEFAULT_MAX_SIZE;
    }
  }

  /**
   * Heap pressure handling.
   *
   * <p>{@code usageThreshold} is the fraction of a heap pool's max at which cached layouts are
   * dropped.
   */
  public record Memory(Boolean enabled, Double usageThreshold) {
    public Memory {
      if (enabled == null) enabled = true;
      if (usageThreshold == null || usageThreshold <= 0.0 || usageThreshold >= 1.0) {
        usageThreshold = MemoryPressureMonitor.DEFAULT_THRESHOLD_FRACTION;
      }
    }
  }

  public record Text(String fontFamily, Integer fontSize) {
    public Text {
      if (fontFamily == null || fontFamily.isBlank()) fontFamily = Font.DIALOG;
      if (fontSize == null || fontSize <= 0) {
        fontSize = LayoutStyles.DEFAULT_MESSAGE_FONT.getSize();
      }
    }

    public Font font() {
      return new Font(fontFamily, Font.PLAIN, fontSize);
    }
  }

  /** Per-direction overrides. Unset values keep the direction's built-in default. */
  public record Direction(Integer avatarSize, AvatarPosition.Vertical avatarAnchor) {
    public Direction {
      if (avatarSize != null && avatarSize < 0) avatarSize = 0;
    }

    SizingConfiguration applyTo(SizingConfiguration base) {
      SizingConfiguration out = base;
      if (avatarSize != null) out = out.withAvatarSize(new Size(avatarSize, avatarSize));
      if (avatarAnchor != null) {
        out = out.withAvatarPosition(out.avatarPosition().withVertical(avatarAnchor));
      }
      return out;
    }
  }

  public record TypingIndicator(Integer height) {
    public TypingIndicator {
      if (height == null || height <= 0) height = LayoutStyles.DEFAULT_TYPING_INDICATOR_HEIGHT;
    }
  }

  public ChatLayoutProperties {
    if (cache == null) cache = new Cache(null);
    if (memory == null) memory = new Memory(null, null);
    if (text == null) text = new Text(null, null);
    if (incoming == null) incoming = new Direction(null, null);
    if (outgoing == null) outgoing = new Direction(null, null);
    if (avatarLeadingTrailingPadding == null || avatarLeadingTrailingPadding < 0) {
      avatarLeadingTrailingPadding = 0;
    }
    if (typingIndicator == null) typingIndicator = new TypingIndicator(null);
  }

  /** The layout styles these properties describe. */
  public LayoutStyles toStyles() {
    return new LayoutStyles(
        incoming.applyTo(SizingConfiguration.incomingDefaults()),
        outgoing.applyTo(SizingConfiguration.outgoingDefaults()),
        avatarLeadingTrailingPadding,
        text.font(),
        null,
        typingIndicator.height(),
        null,
        null);
  }
}
