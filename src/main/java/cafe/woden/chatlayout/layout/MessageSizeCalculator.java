package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.layout.api.LayoutPolicy;
import cafe.woden.chatlayout.model.Entry;
import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.StyledText;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared cell composition for message kinds: avatar, caption labels, timestamp label, container
 * (sized by a {@link ContainerSizer}), inline attachment and accessory view.
 */
public final class MessageSizeCalculator implements SizeCalculator {

  private static final Logger log = LoggerFactory.getLogger(MessageSizeCalculator.class);

  private final LayoutContext ctx;
  private final ContainerSizer containerSizer;

  public MessageSizeCalculator(LayoutContext ctx, ContainerSizer containerSizer) {
    this.ctx = Objects.requireNonNull(ctx, "ctx");
    this.containerSizer = Objects.requireNonNull(containerSizer, "containerSizer");
  }

  @Override
  public LayoutAttributes computeAttributes(Entry entry, ItemPosition position) {
    Message message = requireMessage(entry);
    Composition c = compose(message, position);
    MessageSizing s = c.sizing;
    SizingConfiguration cfg = s.config();
    LayoutPolicy policy = ctx.policy();
    int itemWidth = s.itemWidth();

    LayoutAttributes.Builder b =
        LayoutAttributes.builder()
            .cellSize(new Size(itemWidth, c.cellHeight()))
            .avatarSize(s.avatarSize())
            .avatarPosition(s.avatarPosition())
            .avatarLeadingTrailingPadding(s.styles().avatarLeadingTrailingPadding())
            .messageContainerPadding(cfg.messagePadding())
            .messageContainerSize(c.containerSize)
            .cellTopLabel(
                new Size(itemWidth, c.cellTopLabelHeight),
                policy
                    .cellTopLabelAlignment(message, position)
                    .orElse(cfg.cellTopLabelAlignment()))
            .cellBottomLabel(
                new Size(itemWidth, c.cellBottomLabelHeight),
                policy
                    .cellBottomLabelAlignment(message, position)
                    .orElse(cfg.cellBottomLabelAlignment()))
            .messageTopLabel(
                new Size(itemWidth, c.messageTopLabelHeight),
                policy
                    .messageTopLabelAlignment(message, position)
                    .orElse(cfg.messageTopLabelAlignment()))
            .messageBottomLabel(
                new Size(itemWidth, c.messageBottomLabelHeight),
                policy
                    .messageBottomLabelAlignment(message, position)
                    .orElse(cfg.messageBottomLabelAlignment()))
            .messageTimeLabelSize(messageTimeLabelSize(message, position, itemWidth))
            .accessory(s.accessorySize(), cfg.accessoryPadding(), s.accessoryPosition())
            .attachment(s.attachmentSize(), cfg.attachmentPadding())
            .messageLabelFont(s.styles().messageLabelFont())
            .linkPreviewFonts(s.styles().linkPreviewFonts());

    containerSizer.decorate(message, s, b);
    return b.build();
  }

  @Override
  public Size computeCellSize(Entry entry, ItemPosition position) {
    Message message = requireMessage(entry);
    Composition c = compose(message, position);
    return new Size(c.sizing.itemWidth(), c.cellHeight());
  }

  /**
   * Cell height for the given avatar anchor.
   *
   * <p>Cell anchors and {@code MESSAGE_CENTER} take the max of the avatar and the whole label
   * stack. The other message anchors keep one caption outside the max since the avatar is pinned
   * to the bubble, not the cell. The accessory height is a floor in every case.
   */
  static int cellContentHeight(
      AvatarPosition.Vertical anchor,
      int avatarHeight,
      int cellTopLabelHeight,
      int messageTopLabelHeight,
      int containerHeight,
      int containerVerticalPadding,
      int messageBottomLabelHeight,
      int cellBottomLabelHeight,
      int accessoryHeight) {
    int height;
    switch (anchor) {
      case MESSAGE_BOTTOM:
        {
          int stack =
              containerHeight + containerVerticalPadding + cellTopLabelHeight + messageTopLabelHeight;
          height = messageBottomLabelHeight + cellBottomLabelHeight + Math.max(stack, avatarHeight);
          break;
        }
      case MESSAGE_TOP:
        {
          int stack =
              containerHeight
                  + containerVerticalPadding
                  + messageBottomLabelHeight
                  + cellBottomLabelHeight;
          height = cellTopLabelHeight + messageTopLabelHeight + Math.max(stack, avatarHeight);
          break;
        }
      case MESSAGE_LABEL_TOP:
        {
          int stack =
              containerHeight
                  + messageBottomLabelHeight
                  + containerVerticalPadding
                  + messageTopLabelHeight
                  + cellBottomLabelHeight;
          height = cellTopLabelHeight + Math.max(stack, avatarHeight);
          break;
        }
      case MESSAGE_CENTER:
      case CELL_TOP:
      case CELL_BOTTOM:
      default:
        {
          int total =
              cellTopLabelHeight
                  + messageTopLabelHeight
                  + containerHeight
                  + containerVerticalPadding
                  + messageBottomLabelHeight
                  + cellBottomLabelHeight;
          height = Math.max(avatarHeight, total);
          break;
        }
    }
    return Math.max(height, accessoryHeight);
  }

  private Composition compose(Message message, ItemPosition position) {
    MessageSizing sizing = new MessageSizing(message, position, ctx);
    LayoutPolicy policy = ctx.policy();

    Composition c = new Composition(sizing);
    c.containerSize = containerSizeWithAttachment(message, sizing);
    c.cellTopLabelHeight = labelHeight("cellTop", policy.cellTopLabelHeight(message, position));
    c.messageTopLabelHeight =
        labelHeight("messageTop", policy.messageTopLabelHeight(message, position));
    c.messageBottomLabelHeight =
        labelHeight("messageBottom", policy.messageBottomLabelHeight(message, position));
    c.cellBottomLabelHeight =
        labelHeight("cellBottom", policy.cellBottomLabelHeight(message, position));
    return c;
  }

  private Size containerSizeWithAttachment(Message message, MessageSizing sizing) {
    Size base = containerSizer.containerSize(message, sizing);
    if (base.width() > sizing.containerMaxWidth()) {
      base = base.withWidth(sizing.containerMaxWidth());
    }
    if (!sizing.hasAttachment()) return base;

    EdgeInsets pad = sizing.config().attachmentPadding();
    return new Size(
        sizing.containerMaxWidth(),
        base.height() + sizing.attachmentSize().height() + pad.vertical());
  }

  private Size messageTimeLabelSize(Message message, ItemPosition position, int itemWidth) {
    StyledText text = ctx.source().timestampLabelText(message, position).orElse(null);
    if (text == null || text.isEmpty()) return Size.ZERO;
    return ctx.measurer().measure(text, itemWidth);
  }

  private static int labelHeight(String label, int height) {
    if (height >= 0) return height;
    log.warn("[layout] layout policy returned negative {} label height {}; using 0", label, height);
    return 0;
  }

  static Message requireMessage(Entry entry) {
    if (entry instanceof Entry.MessageEntry m) return m.message();
    throw new LayoutPreconditionException(
        LayoutPreconditionException.Missing.SIZE_CALCULATOR,
        "message calculator cannot size entry " + entry);
  }

  private static final class Composition {
    final MessageSizing sizing;
    Size containerSize = Size.ZERO;
    int cellTopLabelHeight;
    int messageTopLabelHeight;
    int messageBottomLabelHeight;
    int cellBottomLabelHeight;

    Composition(MessageSizing sizing) {
      this.sizing = sizing;
    }

    int cellHeight() {
      return cellContentHeight(
          sizing.avatarPosition().vertical(),
          sizing.avatarSize().height(),
          cellTopLabelHeight,
          messageTopLabelHeight,
          containerSize.height(),
          sizing.config().messagePadding().vertical(),
          messageBottomLabelHeight,
          cellBottomLabelHeight,
          sizing.accessorySize().height());
    }
  }
}
