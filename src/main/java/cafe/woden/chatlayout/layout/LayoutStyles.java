package cafe.woden.chatlayout.layout;

import java.awt.Font;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Everything the calculators read besides the collaborators: per-direction {@link
 * SizingConfiguration}s plus the few thread-wide values.
 */
@ValueObject
public record LayoutStyles(
    SizingConfiguration incoming,
    SizingConfiguration outgoing,
    int avatarLeadingTrailingPadding,
    Font messageLabelFont,
    LinkPreviewFonts linkPreviewFonts,
    int typingIndicatorHeight,
    EdgeInsets typingIndicatorInsets,
    EdgeInsets systemMessagePadding) {

  public static final Font DEFAULT_MESSAGE_FONT = new Font(Font.DIALOG, Font.PLAIN, 17);
  public static final int DEFAULT_TYPING_INDICATOR_HEIGHT = 62;

  public LayoutStyles {
    if (incoming == null) incoming = SizingConfiguration.incomingDefaults();
    if (outgoing == null) outgoing = SizingConfiguration.outgoingDefaults();
    avatarLeadingTrailingPadding = Math.max(0, avatarLeadingTrailingPadding);
    if (messageLabelFont == null) messageLabelFont = DEFAULT_MESSAGE_FONT;
    if (linkPreviewFonts == null) linkPreviewFonts = LinkPreviewFonts.derivedFrom(messageLabelFont);
    if (typingIndicatorHeight <= 0) typingIndicatorHeight = DEFAULT_TYPING_INDICATOR_HEIGHT;
    if (typingIndicatorInsets == null) typingIndicatorInsets = EdgeInsets.ZERO;
    if (systemMessagePadding == null) systemMessagePadding = new EdgeInsets(8, 16, 8, 16);
  }

  public static LayoutStyles defaults() {
    return new LayoutStyles(null, null, 0, null, null, 0, null, null);
  }

  public SizingConfiguration forDirection(boolean fromCurrentSender) {
    return fromCurrentSender ? outgoing : incoming;
  }

  public LayoutStyles withAvatarLeadingTrailingPadding(int padding) {
    return new LayoutStyles(
        incoming,
        outgoing,
        padding,
        messageLabelFont,
        linkPreviewFonts,
        typingIndicatorHeight,
        typingIndicatorInsets,
        systemMessagePadding);
  }
}
