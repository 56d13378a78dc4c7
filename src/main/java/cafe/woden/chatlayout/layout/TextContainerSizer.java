package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.MessageKind;
import cafe.woden.chatlayout.model.StyledText;
import java.awt.Font;

/** Text, attributed text and emoji: measured label plus the direction's label insets. */
public class TextContainerSizer implements ContainerSizer {

  @Override
  public Size containerSize(Message message, MessageSizing sizing) {
    return labelContainerSize(styledTextOf(message, sizing.styles().messageLabelFont()), sizing);
  }

  @Override
  public void decorate(Message message, MessageSizing sizing, LayoutAttributes.Builder attrs) {
    attrs.messageLabelInsets(sizing.config().messageLabelInsets());
    attrs.messageLabelFont(labelFontOf(message, sizing.styles().messageLabelFont()));
  }

  /**
   * Measures {@code text} inside the label insets. With an attachment and no text, only the top
   * inset is kept so the bubble does not reserve an empty line above the attachment.
   */
  static Size labelContainerSize(StyledText text, MessageSizing sizing) {
    EdgeInsets insets = sizing.config().messageLabelInsets();
    int maxWidth = sizing.containerMaxWidth() - insets.horizontal();
    Size label = sizing.measurer().measure(text, maxWidth);

    int height;
    if (sizing.hasAttachment() && text.isEmpty()) {
      height = insets.top();
    } else {
      height = label.height() + insets.vertical();
    }
    return new Size(label.width() + insets.horizontal(), height);
  }

  static StyledText styledTextOf(Message message, Font bodyFont) {
    MessageKind kind = message.kind();
    if (kind instanceof MessageKind.Text t) return StyledText.plain(t.text(), bodyFont);
    if (kind instanceof MessageKind.Emoji e) return StyledText.plain(e.text(), bodyFont);
    if (kind instanceof MessageKind.AttributedText a) return a.text();
    if (kind instanceof MessageKind.LinkPreview lp) {
      StyledText attributed = lp.link().attributedText();
      return attributed != null ? attributed : StyledText.plain(lp.link().text(), bodyFont);
    }
    throw new LayoutPreconditionException(
        LayoutPreconditionException.Missing.SIZE_CALCULATOR,
        "text container cannot size message kind " + kind.type());
  }

  /** Attributed text is drawn with the font of its first character. */
  static Font labelFontOf(Message message, Font bodyFont) {
    StyledText attributed = null;
    if (message.kind() instanceof MessageKind.AttributedText a) attributed = a.text();
    if (message.kind() instanceof MessageKind.LinkPreview lp) attributed = lp.link().attributedText();
    if (attributed == null || attributed.isEmpty()) return bodyFont;
    Font f = attributed.fontAt(0);
    return f != null ? f : bodyFont;
  }
}
