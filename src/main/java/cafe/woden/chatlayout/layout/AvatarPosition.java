package cafe.woden.chatlayout.layout;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Where the avatar sits. The vertical anchor also decides how the cell height is composed, see
 * {@link MessageSizeCalculator#cellContentHeight}.
 */
@ValueObject
public record AvatarPosition(Horizontal horizontal, Vertical vertical) {

  public enum Horizontal {
    CELL_LEADING,
    CELL_TRAILING,
    /** Leading for other senders, trailing for the current sender. */
    NATURAL
  }

  public enum Vertical {
    CELL_TOP,
    MESSAGE_LABEL_TOP,
    MESSAGE_TOP,
    MESSAGE_CENTER,
    MESSAGE_BOTTOM,
    CELL_BOTTOM
  }

  public static final AvatarPosition DEFAULT =
      new AvatarPosition(Horizontal.NATURAL, Vertical.CELL_BOTTOM);

  public AvatarPosition {
    if (horizontal == null) horizontal = Horizontal.NATURAL;
    if (vertical == null) vertical = Vertical.CELL_BOTTOM;
  }

  public AvatarPosition(Vertical vertical) {
    this(Horizontal.NATURAL, vertical);
  }

  /** Replaces {@link Horizontal#NATURAL} with the side matching the sender direction. */
  public AvatarPosition resolve(boolean fromCurrentSender) {
    if (horizontal != Horizontal.NATURAL) return this;
    return new AvatarPosition(
        fromCurrentSender ? Horizontal.CELL_TRAILING : Horizontal.CELL_LEADING, vertical);
  }

  public AvatarPosition withVertical(Vertical v) {
    return Objects.equals(v, vertical) ? this : new AvatarPosition(horizontal, v);
  }
}
