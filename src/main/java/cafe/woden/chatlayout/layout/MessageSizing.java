package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.layout.api.LayoutPolicy;
import cafe.woden.chatlayout.model.Message;

/**
 * Everything resolved for one message before its container is sized: sender direction, the
 * winning value of each overridable facet, and the container width budget.
 *
 * <p>Built once per computation so the layout policy and the "is mine" predicate are consulted
 * exactly once per facet.
 */
public final class MessageSizing {

  private final ItemPosition position;
  private final boolean fromCurrentSender;
  private final SizingConfiguration config;
  private final LayoutStyles styles;
  private final TextMeasurer measurer;
  private final int itemWidth;

  private final Size avatarSize;
  private final AvatarPosition avatarPosition;
  private final Size accessorySize;
  private final AccessoryPosition accessoryPosition;
  private final int containerMaxWidth;
  private final Size attachmentSize;

  MessageSizing(Message message, ItemPosition position, LayoutContext ctx) {
    this.position = position;
    this.fromCurrentSender = ctx.source().isMine(message);
    this.styles = ctx.styles();
    this.config = styles.forDirection(fromCurrentSender);
    this.measurer = ctx.measurer();
    this.itemWidth = Math.max(0, ctx.itemWidth());

    LayoutPolicy policy = ctx.policy();
    this.avatarSize = policy.avatarSize(message, position).orElse(config.avatarSize());
    this.avatarPosition =
        policy
            .avatarPosition(message, position)
            .orElse(config.avatarPosition())
            .resolve(fromCurrentSender);
    this.accessorySize = policy.accessorySize(message, position).orElse(config.accessorySize());
    this.accessoryPosition =
        policy.accessoryPosition(message, position).orElse(config.accessoryPosition());

    int budget =
        itemWidth
            - avatarSize.width()
            - config.messagePadding().horizontal()
            - accessorySize.width()
            - config.accessoryPadding().horizontal()
            - styles.avatarLeadingTrailingPadding();
    this.containerMaxWidth = Math.max(0, budget);

    int attachmentMaxWidth = Math.max(0, containerMaxWidth - config.attachmentPadding().horizontal());
    var attachmentHeight = policy.attachmentHeight(message, position, attachmentMaxWidth);
    this.attachmentSize =
        attachmentHeight.isPresent()
            ? new Size(attachmentMaxWidth, attachmentHeight.getAsInt())
            : Size.ZERO;
  }

  public ItemPosition position() {
    return position;
  }

  public boolean fromCurrentSender() {
    return fromCurrentSender;
  }

  public SizingConfiguration config() {
    return config;
  }

  public LayoutStyles styles() {
    return styles;
  }

  public TextMeasurer measurer() {
    return measurer;
  }

  public int itemWidth() {
    return itemWidth;
  }

  public Size avatarSize() {
    return avatarSize;
  }

  public AvatarPosition avatarPosition() {
    return avatarPosition;
  }

  public Size accessorySize() {
    return accessorySize;
  }

  public AccessoryPosition accessoryPosition() {
    return accessoryPosition;
  }

  /** Widest the container may get. Never negative. */
  public int containerMaxWidth() {
    return containerMaxWidth;
  }

  public Size attachmentSize() {
    return attachmentSize;
  }

  public boolean hasAttachment() {
    return !attachmentSize.isZero();
  }
}
