package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.StyledText;

/** Measures wrapped styled text. */
public interface TextMeasurer {

  /**
   * Size of {@code text} wrapped at {@code maxWidth}, both components rounded up to whole pixels.
   * Empty text or a non-positive {@code maxWidth} measures as {@link Size#ZERO}.
   */
  Size measure(StyledText text, int maxWidth);
}
