package cafe.woden.chatlayout.layout;

import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record HorizontalInsets(int left, int right) {

  public static final HorizontalInsets ZERO = new HorizontalInsets(0, 0);

  public HorizontalInsets {
    left = Math.max(0, left);
    right = Math.max(0, right);
  }

  public int horizontal() {
    return left + right;
  }
}
