package cafe.woden.chatlayout.layout;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Style defaults for one sender direction (incoming or outgoing).
 *
 * <p>Used whenever the {@link cafe.woden.chatlayout.layout.api.LayoutPolicy} declines to answer.
 * Null components fall back to the incoming defaults.
 */
@ValueObject
public record SizingConfiguration(
    Size avatarSize,
    AvatarPosition avatarPosition,
    EdgeInsets messagePadding,
    EdgeInsets messageLabelInsets,
    LabelAlignment cellTopLabelAlignment,
    LabelAlignment cellBottomLabelAlignment,
    LabelAlignment messageTopLabelAlignment,
    LabelAlignment messageBottomLabelAlignment,
    Size accessorySize,
    HorizontalInsets accessoryPadding,
    AccessoryPosition accessoryPosition,
    EdgeInsets attachmentPadding) {

  public static final int DEFAULT_AVATAR_SIZE = 30;
  public static final int DEFAULT_LABEL_INSET = 42;

  public SizingConfiguration {
    if (avatarSize == null) avatarSize = new Size(DEFAULT_AVATAR_SIZE, DEFAULT_AVATAR_SIZE);
    if (avatarPosition == null) avatarPosition = AvatarPosition.DEFAULT;
    if (messagePadding == null) messagePadding = new EdgeInsets(0, 4, 0, 30);
    if (messageLabelInsets == null) messageLabelInsets = new EdgeInsets(7, 18, 7, 14);
    if (cellTopLabelAlignment == null) cellTopLabelAlignment = LabelAlignment.CENTERED;
    if (cellBottomLabelAlignment == null) {
      cellBottomLabelAlignment = LabelAlignment.left(DEFAULT_LABEL_INSET);
    }
    if (messageTopLabelAlignment == null) {
      messageTopLabelAlignment = LabelAlignment.left(DEFAULT_LABEL_INSET);
    }
    if (messageBottomLabelAlignment == null) {
      messageBottomLabelAlignment = LabelAlignment.left(DEFAULT_LABEL_INSET);
    }
    if (accessorySize == null) accessorySize = Size.ZERO;
    if (accessoryPadding == null) accessoryPadding = HorizontalInsets.ZERO;
    if (accessoryPosition == null) accessoryPosition = AccessoryPosition.MESSAGE_CENTER;
    if (attachmentPadding == null) attachmentPadding = new EdgeInsets(0, 18, 7, 14);
  }

  public static SizingConfiguration incomingDefaults() {
    return new SizingConfiguration(
        null, null, null, null, null, null, null, null, null, null, null, null);
  }

  public static SizingConfiguration outgoingDefaults() {
    return new SizingConfiguration(
        null,
        null,
        new EdgeInsets(0, 30, 0, 4),
        new EdgeInsets(7, 14, 7, 18),
        LabelAlignment.CENTERED,
        LabelAlignment.right(DEFAULT_LABEL_INSET),
        LabelAlignment.right(DEFAULT_LABEL_INSET),
        LabelAlignment.right(DEFAULT_LABEL_INSET),
        null,
        null,
        null,
        new EdgeInsets(0, 14, 7, 18));
  }

  public SizingConfiguration withAvatarSize(Size size) {
    return new SizingConfiguration(
        size,
        avatarPosition,
        messagePadding,
        messageLabelInsets,
        cellTopLabelAlignment,
        cellBottomLabelAlignment,
        messageTopLabelAlignment,
        messageBottomLabelAlignment,
        accessorySize,
        accessoryPadding,
        accessoryPosition,
        attachmentPadding);
  }

  public SizingConfiguration withAvatarPosition(AvatarPosition position) {
    return new SizingConfiguration(
        avatarSize,
        position,
        messagePadding,
        messageLabelInsets,
        cellTopLabelAlignment,
        cellBottomLabelAlignment,
        messageTopLabelAlignment,
        messageBottomLabelAlignment,
        accessorySize,
        accessoryPadding,
        accessoryPosition,
        attachmentPadding);
  }
}
