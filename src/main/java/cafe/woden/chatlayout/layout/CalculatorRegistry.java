package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Entry;
import cafe.woden.chatlayout.model.MessageKind;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Picks the {@link SizeCalculator} for an entry by message kind.
 *
 * <p>Every built-in kind is registered on construction. {@link MessageKind.Type#CUSTOM} is left to
 * the host; asking for an unregistered kind fails with {@link LayoutPreconditionException}.
 */
public final class CalculatorRegistry {

  private final LayoutContext ctx;
  private final Map<MessageKind.Type, SizeCalculator> byKind = new EnumMap<>(MessageKind.Type.class);
  private final SizeCalculator typingIndicator;

  public CalculatorRegistry(LayoutContext ctx) {
    this.ctx = Objects.requireNonNull(ctx, "ctx");

    SizeCalculator text = new MessageSizeCalculator(ctx, new TextContainerSizer());
    SizeCalculator media = new MessageSizeCalculator(ctx, new MediaContainerSizer());
    byKind.put(MessageKind.Type.TEXT, text);
    byKind.put(MessageKind.Type.ATTRIBUTED_TEXT, text);
    byKind.put(MessageKind.Type.EMOJI, text);
    byKind.put(MessageKind.Type.PHOTO, media);
    byKind.put(MessageKind.Type.VIDEO, media);
    byKind.put(MessageKind.Type.LOCATION, media);
    byKind.put(MessageKind.Type.AUDIO, media);
    byKind.put(
        MessageKind.Type.CONTACT, new MessageSizeCalculator(ctx, new ContactContainerSizer()));
    byKind.put(
        MessageKind.Type.LINK_PREVIEW,
        new MessageSizeCalculator(ctx, new LinkPreviewContainerSizer()));
    byKind.put(MessageKind.Type.SYSTEM, new SystemMessageSizeCalculator(ctx));
    typingIndicator = new TypingIndicatorSizeCalculator(ctx);
  }

  public CalculatorRegistry register(MessageKind.Type type, SizeCalculator calculator) {
    byKind.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(calculator, "calculator"));
    return this;
  }

  /** Registers the shared message composition around {@code sizer}. */
  public CalculatorRegistry register(MessageKind.Type type, ContainerSizer sizer) {
    return register(type, new MessageSizeCalculator(ctx, sizer));
  }

  public boolean supports(MessageKind.Type type) {
    return byKind.containsKey(type);
  }

  public SizeCalculator calculatorFor(Entry entry) {
    Objects.requireNonNull(entry, "entry");
    if (entry instanceof Entry.TypingIndicator) return typingIndicator;

    MessageKind.Type type = ((Entry.MessageEntry) entry).message().kind().type();
    SizeCalculator calculator = byKind.get(type);
    if (calculator == null) {
      throw new LayoutPreconditionException(
          LayoutPreconditionException.Missing.SIZE_CALCULATOR,
          "no size calculator registered for message kind " + type);
    }
    return calculator;
  }
}
