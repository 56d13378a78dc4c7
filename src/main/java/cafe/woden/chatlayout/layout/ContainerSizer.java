package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Message;

/**
 * Sizes the message container (the bubble) for one family of message kinds.
 *
 * <p>{@link MessageSizeCalculator} owns everything around the container and delegates only this
 * part. Implementations must not throw for degenerate widths.
 */
public interface ContainerSizer {

  /** Container size before any inline attachment is added. */
  Size containerSize(Message message, MessageSizing sizing);

  /** Adds kind-specific values (fonts, label insets) to the attributes. */
  default void decorate(Message message, MessageSizing sizing, LayoutAttributes.Builder attrs) {}
}
