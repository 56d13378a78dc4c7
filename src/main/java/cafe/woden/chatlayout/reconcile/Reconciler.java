package cafe.woden.chatlayout.reconcile;

import cafe.woden.chatlayout.layout.ItemPosition;
import cafe.woden.chatlayout.layout.ThreadSnapshot;
import cafe.woden.chatlayout.model.Entry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides how the presentation layer gets from one snapshot to the next.
 *
 * <ul>
 *   <li>entries added or removed: {@link UpdatePlan.Structural}.
 *   <li>same entries, different order: {@link UpdatePlan.Structural} with moves only.
 *   <li>same entries in the same places: {@link UpdatePlan.SelectiveRefresh} of the entries whose
 *       content changed, or {@link UpdatePlan.NoOp} if none did.
 * </ul>
 *
 * <p>Pure: no side effects, safe to call from any thread.
 */
public final class Reconciler {

  public UpdatePlan plan(ThreadSnapshot previous, ThreadSnapshot next) {
    Objects.requireNonNull(previous, "previous");
    Objects.requireNonNull(next, "next");

    Set<Entry.Key> oldKeys = previous.keys();
    Set<Entry.Key> newKeys = next.keys();

    List<Entry.Key> inserted = new ArrayList<>();
    for (Entry.Key key : newKeys) {
      if (!oldKeys.contains(key)) inserted.add(key);
    }
    List<Entry.Key> removed = new ArrayList<>();
    for (Entry.Key key : oldKeys) {
      if (!newKeys.contains(key)) removed.add(key);
    }

    List<Entry.Key> moved = movedKeys(previous, next);
    if (!inserted.isEmpty() || !removed.isEmpty() || !moved.isEmpty()) {
      return new UpdatePlan.Structural(
          previous, next, inserted, removed, moved, changedKeys(previous, next));
    }

    List<UpdatePlan.Refresh> refreshed = new ArrayList<>();
    for (Entry entry : next.entries()) {
      ItemPosition pos = next.positionOf(entry.key()).orElseThrow();
      Entry before = previous.entryAt(previous.positionOf(entry.key()).orElseThrow());
      if (!entry.sameContent(before)) refreshed.add(new UpdatePlan.Refresh(entry.key(), pos));
    }
    return refreshed.isEmpty() ? UpdatePlan.noOp() : new UpdatePlan.SelectiveRefresh(next, refreshed);
  }

  /** Surviving entries whose content differs between the two snapshots. */
  static List<Entry.Key> changedKeys(ThreadSnapshot previous, ThreadSnapshot next) {
    List<Entry.Key> out = new ArrayList<>();
    for (Entry entry : next.entries()) {
      var before = previous.positionOf(entry.key());
      if (before.isEmpty()) continue;
      if (!entry.sameContent(previous.entryAt(before.get()))) out.add(entry.key());
    }
    return out;
  }

  /**
   * Surviving entries that have to move. Entries on the longest run that keeps its relative order
   * stay put; everything else among the survivors is reported, in new order. An entry that keeps
   * its relative order but changes section also counts as moved.
   */
  static List<Entry.Key> movedKeys(ThreadSnapshot previous, ThreadSnapshot next) {
    List<Entry.Key> survivorsInOldOrder = new ArrayList<>();
    for (Entry.Key key : previous.keys()) {
      if (next.contains(key)) survivorsInOldOrder.add(key);
    }
    if (survivorsInOldOrder.isEmpty()) return List.of();

    Map<Entry.Key, Integer> newRank = new HashMap<>();
    int rank = 0;
    for (Entry.Key key : next.keys()) {
      if (previous.contains(key)) newRank.put(key, rank++);
    }

    int n = survivorsInOldOrder.size();
    int[] seq = new int[n];
    for (int i = 0; i < n; i++) seq[i] = newRank.get(survivorsInOldOrder.get(i));
    boolean[] stays = longestIncreasingRun(seq);

    Map<Entry.Key, Integer> oldIndex = new HashMap<>();
    for (int i = 0; i < n; i++) oldIndex.put(survivorsInOldOrder.get(i), i);

    List<Entry.Key> moved = new ArrayList<>();
    for (Entry.Key key : next.keys()) {
      Integer i = oldIndex.get(key);
      if (i == null) continue;
      if (!stays[i] || sectionChanged(previous, next, key)) moved.add(key);
    }
    return moved;
  }

  /** Marks the members of one longest strictly increasing subsequence of {@code seq}. */
  static boolean[] longestIncreasingRun(int[] seq) {
    int n = seq.length;
    int[] tailIndex = new int[n];
    int[] parent = new int[n];
    Arrays.fill(parent, -1);
    int length = 0;

    for (int i = 0; i < n; i++) {
      int lo = 0;
      int hi = length;
      while (lo < hi) {
        int mid = (lo + hi) >>> 1;
        if (seq[tailIndex[mid]] < seq[i]) lo = mid + 1;
        else hi = mid;
      }
      if (lo > 0) parent[i] = tailIndex[lo - 1];
      tailIndex[lo] = i;
      if (lo == length) length++;
    }

    boolean[] member = new boolean[n];
    if (length == 0) return member;
    for (int i = tailIndex[length - 1]; i >= 0; i = parent[i]) member[i] = true;
    return member;
  }

  private static boolean sectionChanged(
      ThreadSnapshot previous, ThreadSnapshot next, Entry.Key key) {
    int before = previous.positionOf(key).map(ItemPosition::section).orElse(-1);
    int after = next.positionOf(key).map(ItemPosition::section).orElse(-1);
    return before != after;
  }
}
