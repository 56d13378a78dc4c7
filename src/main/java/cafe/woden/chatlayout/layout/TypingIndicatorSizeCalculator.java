package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Entry;
import java.util.Objects;

/** Full-width row for the typing indicator. */
public final class TypingIndicatorSizeCalculator implements SizeCalculator {

  private final LayoutContext ctx;

  public TypingIndicatorSizeCalculator(LayoutContext ctx) {
    this.ctx = Objects.requireNonNull(ctx, "ctx");
  }

  @Override
  public LayoutAttributes computeAttributes(Entry entry, ItemPosition position) {
    requireIndicator(entry);
    EdgeInsets insets = ctx.styles().typingIndicatorInsets();
    int indicatorHeight = indicatorHeight(position);
    int width = Math.max(0, ctx.itemWidth());
    return LayoutAttributes.builder()
        .cellSize(new Size(width, indicatorHeight + insets.vertical()))
        .messageContainerSize(new Size(width - insets.horizontal(), indicatorHeight))
        .messageContainerPadding(insets)
        .build();
  }

  @Override
  public Size computeCellSize(Entry entry, ItemPosition position) {
    requireIndicator(entry);
    EdgeInsets insets = ctx.styles().typingIndicatorInsets();
    return new Size(ctx.itemWidth(), indicatorHeight(position) + insets.vertical());
  }

  private int indicatorHeight(ItemPosition position) {
    int h = ctx.policy().typingIndicatorHeight(position).orElse(ctx.styles().typingIndicatorHeight());
    return Math.max(0, h);
  }

  private static void requireIndicator(Entry entry) {
    if (entry instanceof Entry.TypingIndicator) return;
    throw new LayoutPreconditionException(
        LayoutPreconditionException.Missing.SIZE_CALCULATOR,
        "typing indicator calculator cannot size entry " + entry);
  }
}
