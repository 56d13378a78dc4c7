package cafe.woden.chatlayout.layout;

import java.awt.Font;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Computed geometry of one cell.
 *
 * <p>Instances are only ever produced by a {@link Builder}; once built they never change, so a
 * cached instance can be handed out as is. Two computations for the same input are {@code
 * equals}.
 */
@ValueObject
public record LayoutAttributes(
    Size cellSize,
    Size avatarSize,
    AvatarPosition avatarPosition,
    int avatarLeadingTrailingPadding,
    Size messageContainerSize,
    EdgeInsets messageContainerPadding,
    Font messageLabelFont,
    EdgeInsets messageLabelInsets,
    Size cellTopLabelSize,
    LabelAlignment cellTopLabelAlignment,
    Size cellBottomLabelSize,
    LabelAlignment cellBottomLabelAlignment,
    Size messageTopLabelSize,
    LabelAlignment messageTopLabelAlignment,
    Size messageBottomLabelSize,
    LabelAlignment messageBottomLabelAlignment,
    Size messageTimeLabelSize,
    Size accessorySize,
    HorizontalInsets accessoryPadding,
    AccessoryPosition accessoryPosition,
    Size attachmentSize,
    EdgeInsets attachmentPadding,
    LinkPreviewFonts linkPreviewFonts) {

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private Size cellSize = Size.ZERO;
    private Size avatarSize = Size.ZERO;
    private AvatarPosition avatarPosition = AvatarPosition.DEFAULT;
    private int avatarLeadingTrailingPadding;
    private Size messageContainerSize = Size.ZERO;
    private EdgeInsets messageContainerPadding = EdgeInsets.ZERO;
    private Font messageLabelFont = LayoutStyles.DEFAULT_MESSAGE_FONT;
    private EdgeInsets messageLabelInsets = EdgeInsets.ZERO;
    private Size cellTopLabelSize = Size.ZERO;
    private LabelAlignment cellTopLabelAlignment = LabelAlignment.CENTERED;
    private Size cellBottomLabelSize = Size.ZERO;
    private LabelAlignment cellBottomLabelAlignment = LabelAlignment.CENTERED;
    private Size messageTopLabelSize = Size.ZERO;
    private LabelAlignment messageTopLabelAlignment = LabelAlignment.CENTERED;
    private Size messageBottomLabelSize = Size.ZERO;
    private LabelAlignment messageBottomLabelAlignment = LabelAlignment.CENTERED;
    private Size messageTimeLabelSize = Size.ZERO;
    private Size accessorySize = Size.ZERO;
    private HorizontalInsets accessoryPadding = HorizontalInsets.ZERO;
    private AccessoryPosition accessoryPosition = AccessoryPosition.MESSAGE_CENTER;
    private Size attachmentSize = Size.ZERO;
    private EdgeInsets attachmentPadding = EdgeInsets.ZERO;
    private LinkPreviewFonts linkPreviewFonts =
        LinkPreviewFonts.derivedFrom(LayoutStyles.DEFAULT_MESSAGE_FONT);

    private Builder() {}

    public Builder cellSize(Size v) {
      cellSize = v;
      return this;
    }

    public Builder avatarSize(Size v) {
      avatarSize = v;
      return this;
    }

    public Builder avatarPosition(AvatarPosition v) {
      avatarPosition = v;
      return this;
    }

    public Builder avatarLeadingTrailingPadding(int v) {
      avatarLeadingTrailingPadding = Math.max(0, v);
      return this;
    }

    public Builder messageContainerSize(Size v) {
      messageContainerSize = v;
      return this;
    }

    public Builder messageContainerPadding(EdgeInsets v) {
      messageContainerPadding = v;
      return this;
    }

    public Builder messageLabelFont(Font v) {
      messageLabelFont = v;
      return this;
    }

    public Builder messageLabelInsets(EdgeInsets v) {
      messageLabelInsets = v;
      return this;
    }

    public Builder cellTopLabel(Size size, LabelAlignment alignment) {
      cellTopLabelSize = size;
      cellTopLabelAlignment = alignment;
      return this;
    }

    public Builder cellBottomLabel(Size size, LabelAlignment alignment) {
      cellBottomLabelSize = size;
      cellBottomLabelAlignment = alignment;
      return this;
    }

    public Builder messageTopLabel(Size size, LabelAlignment alignment) {
      messageTopLabelSize = size;
      messageTopLabelAlignment = alignment;
      return this;
    }

    public Builder messageBottomLabel(Size size, LabelAlignment alignment) {
      messageBottomLabelSize = size;
      messageBottomLabelAlignment = alignment;
      return this;
    }

    public Builder messageTimeLabelSize(Size v) {
      messageTimeLabelSize = v;
      return this;
    }

    public Builder accessory(Size size, HorizontalInsets padding, AccessoryPosition position) {
      accessorySize = size;
      accessoryPadding = padding;
      accessoryPosition = position;
      return this;
    }

    public Builder attachment(Size size, EdgeInsets padding) {
      attachmentSize = size;
      attachmentPadding = padding;
      return this;
    }

    public Builder linkPreviewFonts(LinkPreviewFonts v) {
      linkPreviewFonts = v;
      return this;
    }

    public LayoutAttributes build() {
      return new LayoutAttributes(
          cellSize,
          avatarSize,
          avatarPosition,
          avatarLeadingTrailingPadding,
          messageContainerSize,
          messageContainerPadding,
          messageLabelFont,
          messageLabelInsets,
          cellTopLabelSize,
          cellTopLabelAlignment,
          cellBottomLabelSize,
          cellBottomLabelAlignment,
          messageTopLabelSize,
          messageTopLabelAlignment,
          messageBottomLabelSize,
          messageBottomLabelAlignment,
          messageTimeLabelSize,
          accessorySize,
          accessoryPadding,
          accessoryPosition,
          attachmentSize,
          attachmentPadding,
          linkPreviewFonts);
    }
  }
}
