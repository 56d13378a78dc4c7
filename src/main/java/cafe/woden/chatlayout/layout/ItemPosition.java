package cafe.woden.chatlayout.layout;

import org.jmolecules.ddd.annotation.ValueObject;

/** Section/item coordinates of one entry in the thread. */
@ValueObject
public record ItemPosition(int section, int item) {

  public ItemPosition {
    if (section < 0) throw new IllegalArgumentException("section < 0: " + section);
    if (item < 0) throw new IllegalArgumentException("item < 0: " + item);
  }

  public static ItemPosition of(int section, int item) {
    return new ItemPosition(section, item);
  }

  @Override
  public String toString() {
    return "[" + section + ":" + item + "]";
  }
}
