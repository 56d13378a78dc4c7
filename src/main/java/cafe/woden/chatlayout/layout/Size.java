package cafe.woden.chatlayout.layout;

import org.jmolecules.ddd.annotation.ValueObject;

/** Integer width/height. Negative components clamp to zero. */
@ValueObject
public record Size(int width, int height) {

  public static final Size ZERO = new Size(0, 0);

  public Size {
    width = Math.max(0, width);
    height = Math.max(0, height);
  }

  public boolean isZero() {
    return width == 0 && height == 0;
  }

  public Size withWidth(int w) {
    return new Size(w, height);
  }
}
