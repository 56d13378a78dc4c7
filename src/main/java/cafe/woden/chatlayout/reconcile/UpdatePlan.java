package cafe.woden.chatlayout.reconcile;

import cafe.woden.chatlayout.layout.ItemPosition;
import cafe.woden.chatlayout.layout.ThreadSnapshot;
import cafe.woden.chatlayout.model.Entry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** What the presentation layer has to do to go from one snapshot to the next. */
public sealed interface UpdatePlan
    permits UpdatePlan.Structural, UpdatePlan.SelectiveRefresh, UpdatePlan.NoOp {

  enum Kind {
    STRUCTURAL,
    SELECTIVE_REFRESH,
    NO_OP
  }

  Kind kind();

  /**
   * Entries were added, removed or reordered. Apply {@code next} as a whole and animate the
   * listed entries; {@code changed} lists surviving entries whose content also changed.
   */
  record Structural(
      ThreadSnapshot previous,
      ThreadSnapshot next,
      List<Entry.Key> inserted,
      List<Entry.Key> removed,
      List<Entry.Key> moved,
      List<Entry.Key> changed)
      implements UpdatePlan {

    public Structural {
      Objects.requireNonNull(previous, "previous");
      Objects.requireNonNull(next, "next");
      inserted = List.copyOf(inserted);
      removed = List.copyOf(removed);
      moved = List.copyOf(moved);
      changed = List.copyOf(changed);
    }

    @Override
    public Kind kind() {
      return Kind.STRUCTURAL;
    }

    /** Positions of inserted entries in {@link #next()}. */
    public List<ItemPosition> insertedPositions() {
      return positionsIn(next, inserted);
    }

    /** Positions removed entries had in {@link #previous()}. */
    public List<ItemPosition> removedPositions() {
      return positionsIn(previous, removed);
    }
  }

  /** Same entries in the same places; only the listed ones need to be redrawn. */
  record SelectiveRefresh(ThreadSnapshot next, List<Refresh> refreshed) implements UpdatePlan {

    public SelectiveRefresh {
      Objects.requireNonNull(next, "next");
      refreshed = List.copyOf(refreshed);
      if (refreshed.isEmpty()) throw new IllegalArgumentException("nothing to refresh");
    }

    @Override
    public Kind kind() {
      return Kind.SELECTIVE_REFRESH;
    }

    public List<Entry.Key> keys() {
      List<Entry.Key> out = new ArrayList<>(refreshed.size());
      for (Refresh r : refreshed) out.add(r.key());
      return out;
    }
  }

  /** Nothing changed. */
  final class NoOp implements UpdatePlan {
    static final NoOp INSTANCE = new NoOp();

    private NoOp() {}

    @Override
    public Kind kind() {
      return Kind.NO_OP;
    }

    @Override
    public String toString() {
      return "NoOp";
    }
  }

  static UpdatePlan noOp() {
    return NoOp.INSTANCE;
  }

  /** One entry to redraw in place. */
  record Refresh(Entry.Key key, ItemPosition position) {
    public Refresh {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(position, "position");
    }
  }

  private static List<ItemPosition> positionsIn(ThreadSnapshot snapshot, List<Entry.Key> keys) {
    List<ItemPosition> out = new ArrayList<>(keys.size());
    for (Entry.Key key : keys) snapshot.positionOf(key).ifPresent(out::add);
    return out;
  }
}
