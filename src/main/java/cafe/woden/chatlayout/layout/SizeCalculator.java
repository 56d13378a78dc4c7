package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Entry;

/**
 * Turns one entry into cell geometry.
 *
 * <p>Both methods are pure with respect to the bound collaborators and styles: the same input
 * yields {@code equals} results.
 */
public interface SizeCalculator {

  LayoutAttributes computeAttributes(Entry entry, ItemPosition position);

  /** Width is always the item width of the layout. */
  Size computeCellSize(Entry entry, ItemPosition position);
}
