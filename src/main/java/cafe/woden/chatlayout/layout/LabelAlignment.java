package cafe.woden.chatlayout.layout;

import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record LabelAlignment(TextAlignment textAlignment, EdgeInsets textInsets) {

  public enum TextAlignment {
    LEFT,
    CENTER,
    RIGHT
  }

  public static final LabelAlignment CENTERED =
      new LabelAlignment(TextAlignment.CENTER, EdgeInsets.ZERO);

  public LabelAlignment {
    if (textAlignment == null) textAlignment = TextAlignment.CENTER;
    if (textInsets == null) textInsets = EdgeInsets.ZERO;
  }

  public static LabelAlignment left(int inset) {
    return new LabelAlignment(TextAlignment.LEFT, EdgeInsets.left(inset));
  }

  public static LabelAlignment right(int inset) {
    return new LabelAlignment(TextAlignment.RIGHT, EdgeInsets.right(inset));
  }
}
