package cafe.woden.chatlayout.layout;

import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record EdgeInsets(int top, int left, int bottom, int right) {

  public static final EdgeInsets ZERO = new EdgeInsets(0, 0, 0, 0);

  public EdgeInsets {
    top = Math.max(0, top);
    left = Math.max(0, left);
    bottom = Math.max(0, bottom);
    right = Math.max(0, right);
  }

  public static EdgeInsets left(int left) {
    return new EdgeInsets(0, left, 0, 0);
  }

  public static EdgeInsets right(int right) {
    return new EdgeInsets(0, 0, 0, right);
  }

  public int horizontal() {
    return left + right;
  }

  public int vertical() {
    return top + bottom;
  }
}
