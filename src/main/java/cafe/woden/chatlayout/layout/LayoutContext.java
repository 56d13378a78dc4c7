package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.layout.api.LayoutPolicy;
import cafe.woden.chatlayout.layout.api.MessageSource;

/**
 * What a {@link SizeCalculator} reads while it works. Implemented by {@link LayoutEngine}.
 *
 * <p>{@link #source()} and {@link #policy()} throw {@link LayoutPreconditionException} when the
 * collaborator has not been bound.
 */
public interface LayoutContext {

  MessageSource source();

  LayoutPolicy policy();

  LayoutStyles styles();

  TextMeasurer measurer();

  /** Width available to one cell. */
  int itemWidth();
}
