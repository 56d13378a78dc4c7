package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Entry;
import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.MessageKind;
import cafe.woden.chatlayout.model.StyledText;
import java.awt.Font;
import java.util.Objects;

/** Centered caption spanning the whole row. No avatar, labels or accessory. */
public final class SystemMessageSizeCalculator implements SizeCalculator {

  private final LayoutContext ctx;

  public SystemMessageSizeCalculator(LayoutContext ctx) {
    this.ctx = Objects.requireNonNull(ctx, "ctx");
  }

  @Override
  public LayoutAttributes computeAttributes(Entry entry, ItemPosition position) {
    Message message = MessageSizeCalculator.requireMessage(entry);
    EdgeInsets padding = ctx.styles().systemMessagePadding();
    Size container = containerSize(message);
    return LayoutAttributes.builder()
        .cellSize(cellSize(container, padding))
        .avatarSize(Size.ZERO)
        .messageContainerSize(container)
        .messageContainerPadding(padding)
        .messageLabelFont(fontOf(message))
        .build();
  }

  @Override
  public Size computeCellSize(Entry entry, ItemPosition position) {
    Message message = MessageSizeCalculator.requireMessage(entry);
    return cellSize(containerSize(message), ctx.styles().systemMessagePadding());
  }

  private Size cellSize(Size container, EdgeInsets padding) {
    return new Size(ctx.itemWidth(), container.height() + padding.vertical());
  }

  private Size containerSize(Message message) {
    StyledText text = textOf(message);
    int itemWidth = Math.max(0, ctx.itemWidth());
    int maxWidth = itemWidth - ctx.styles().systemMessagePadding().horizontal();
    Size label = ctx.measurer().measure(text, maxWidth);
    return new Size(itemWidth, label.height());
  }

  private Font fontOf(Message message) {
    Font f = textOf(message).fontAt(0);
    return f != null ? f : ctx.styles().messageLabelFont();
  }

  private static StyledText textOf(Message message) {
    if (message.kind() instanceof MessageKind.System s) return s.text();
    throw new LayoutPreconditionException(
        LayoutPreconditionException.Missing.SIZE_CALCULATOR,
        "system calculator cannot size message kind " + message.kind().type());
  }
}
