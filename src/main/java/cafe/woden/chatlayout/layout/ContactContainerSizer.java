package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.MessageKind;
import cafe.woden.chatlayout.model.StyledText;
import java.awt.Font;

/** Contact card: initials avatar on one side, display name next to it. */
public class ContactContainerSizer implements ContainerSizer {

  public static final int MIN_HEIGHT = 65;

  static final EdgeInsets INCOMING_NAME_INSETS = new EdgeInsets(7, 46, 7, 30);
  static final EdgeInsets OUTGOING_NAME_INSETS = new EdgeInsets(7, 41, 7, 35);

  @Override
  public Size containerSize(Message message, MessageSizing sizing) {
    if (!(message.kind() instanceof MessageKind.Contact c)) {
      throw new LayoutPreconditionException(
          LayoutPreconditionException.Missing.SIZE_CALCULATOR,
          "contact container cannot size message kind " + message.kind().type());
    }
    EdgeInsets insets = nameInsets(sizing);
    int maxWidth = sizing.containerMaxWidth() - insets.horizontal();
    Font font = sizing.styles().messageLabelFont();
    Size name = sizing.measurer().measure(StyledText.plain(c.item().displayName(), font), maxWidth);

    int width = Math.min(sizing.containerMaxWidth(), name.width() + insets.horizontal());
    int height = Math.max(MIN_HEIGHT, name.height() + insets.vertical());
    return new Size(width, height);
  }

  @Override
  public void decorate(Message message, MessageSizing sizing, LayoutAttributes.Builder attrs) {
    attrs.messageLabelInsets(nameInsets(sizing));
  }

  private static EdgeInsets nameInsets(MessageSizing sizing) {
    return sizing.fromCurrentSender() ? OUTGOING_NAME_INSETS : INCOMING_NAME_INSETS;
  }
}
