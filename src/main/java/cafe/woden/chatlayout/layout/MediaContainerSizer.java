package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.MessageKind;

/**
 * Photo, video, location and audio: the item's natural size, scaled down to the container width
 * when wider (aspect ratio kept).
 */
public class MediaContainerSizer implements ContainerSizer {

  @Override
  public Size containerSize(Message message, MessageSizing sizing) {
    return fitWidth(naturalSize(message), sizing.containerMaxWidth());
  }

  static Size fitWidth(Size natural, int maxWidth) {
    if (natural.width() <= maxWidth) return natural;
    if (maxWidth <= 0 || natural.width() == 0) return Size.ZERO;
    long scaled = (long) natural.height() * maxWidth;
    int height = (int) ((scaled + natural.width() - 1) / natural.width());
    return new Size(maxWidth, height);
  }

  static Size naturalSize(Message message) {
    MessageKind kind = message.kind();
    if (kind instanceof MessageKind.Photo p) return new Size(p.item().width(), p.item().height());
    if (kind instanceof MessageKind.Video v) return new Size(v.item().width(), v.item().height());
    if (kind instanceof MessageKind.Location l) {
      return new Size(l.item().width(), l.item().height());
    }
    if (kind instanceof MessageKind.Audio a) return new Size(a.item().width(), a.item().height());
    throw new LayoutPreconditionException(
        LayoutPreconditionException.Missing.SIZE_CALCULATOR,
        "media container cannot size message kind " + kind.type());
  }
}
