package cafe.woden.chatlayout.reconcile;

import static cafe.woden.chatlayout.layout.LayoutTestSupport.incoming;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import cafe.woden.chatlayout.layout.ItemPosition;
import cafe.woden.chatlayout.layout.ThreadSnapshot;
import cafe.woden.chatlayout.model.Entry;
import cafe.woden.chatlayout.model.Message;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReconcilerTest {

  private final Reconciler reconciler = new Reconciler();

  private final Message m1 = incoming("m1", "first");
  private final Message m2 = incoming("m2", "second");
  private final Message m3 = incoming("m3", "third");

  @Test
  void appendedMessageIsStructuralInsertAtEnd() {
    UpdatePlan plan = reconciler.plan(snapshot(false, m1, m2), snapshot(false, m1, m2, m3));

    UpdatePlan.Structural s = assertInstanceOf(UpdatePlan.Structural.class, plan);
    assertEquals(keys("m3"), s.inserted());
    assertEquals(List.of(ItemPosition.of(0, 2)), s.insertedPositions());
    assertEquals(List.of(), s.removed());
    assertEquals(List.of(), s.moved());
  }

  @Test
  void singleEditIsSelectiveRefreshOfThatEntryOnly() {
    Message edited = incoming("m1", "first (edited)");

    UpdatePlan plan = reconciler.plan(snapshot(false, m1, m2), snapshot(false, edited, m2));

    UpdatePlan.SelectiveRefresh r = assertInstanceOf(UpdatePlan.SelectiveRefresh.class, plan);
    assertEquals(List.of(new UpdatePlan.Refresh(Entry.Key.message("m1"), ItemPosition.of(0, 0))), r.refreshed());
  }

  @Test
  void unchangedSnapshotIsNoOp() {
    UpdatePlan plan = reconciler.plan(snapshot(false, m1, m2), snapshot(false, m1, m2));

    assertSame(UpdatePlan.noOp(), plan);
    assertEquals(UpdatePlan.Kind.NO_OP, plan.kind());
  }

  @Test
  void removalIsStructuralEvenWhenOthersChanged() {
    Message edited = incoming("m2", "second (edited)");

    UpdatePlan plan = reconciler.plan(snapshot(false, m1, m2, m3), snapshot(false, edited, m3));

    UpdatePlan.Structural s = assertInstanceOf(UpdatePlan.Structural.class, plan);
    assertEquals(keys("m1"), s.removed());
    assertEquals(List.of(ItemPosition.of(0, 0)), s.removedPositions());
    assertEquals(keys("m2"), s.changed());
  }

  @Test
  void togglingTypingIndicatorIsStructural() {
    UpdatePlan shown = reconciler.plan(snapshot(false, m1), snapshot(true, m1));
    UpdatePlan hidden = reconciler.plan(snapshot(true, m1), snapshot(false, m1));

    assertEquals(
        List.of(Entry.Key.TYPING_INDICATOR),
        assertInstanceOf(UpdatePlan.Structural.class, shown).inserted());
    assertEquals(
        List.of(Entry.Key.TYPING_INDICATOR),
        assertInstanceOf(UpdatePlan.Structural.class, hidden).removed());
  }

  @Test
  void typingIndicatorIsNeverRefreshedInPlace() {
    UpdatePlan plan = reconciler.plan(snapshot(true, m1), snapshot(true, m1));

    assertSame(UpdatePlan.noOp(), plan);
  }

  @Test
  void messageSharingTheIndicatorsIdIsADistinctEntry() {
    Message lookalike = incoming("typingIndicator", "hi");

    UpdatePlan plan = reconciler.plan(snapshot(false, lookalike), snapshot(true, lookalike));

    UpdatePlan.Structural s = assertInstanceOf(UpdatePlan.Structural.class, plan);
    assertEquals(List.of(Entry.Key.TYPING_INDICATOR), s.inserted());
    assertEquals(List.of(), s.moved());
    assertEquals(List.of(), s.removed());
    assertEquals(List.of(ItemPosition.of(1, 0)), s.insertedPositions());
  }

  @Test
  void reorderWithSameIdsIsStructuralWithMinimalMoves() {
    UpdatePlan plan = reconciler.plan(snapshot(false, m1, m2, m3), snapshot(false, m3, m1, m2));

    UpdatePlan.Structural s = assertInstanceOf(UpdatePlan.Structural.class, plan);
    assertEquals(keys("m3"), s.moved());
    assertEquals(List.of(), s.inserted());
    assertEquals(List.of(), s.removed());
  }

  @Test
  void movingToAnotherSectionCountsAsMove() {
    ThreadSnapshot before =
        ThreadSnapshot.of(List.of(List.of(Entry.of(m1), Entry.of(m2)), List.of(Entry.of(m3))), false);
    ThreadSnapshot after =
        ThreadSnapshot.of(List.of(List.of(Entry.of(m1)), List.of(Entry.of(m2), Entry.of(m3))), false);

    UpdatePlan.Structural s =
        assertInstanceOf(UpdatePlan.Structural.class, reconciler.plan(before, after));

    assertEquals(keys("m2"), s.moved());
  }

  @Test
  void longestIncreasingRunKeepsTheLargestStableSet() {
    boolean[] stays = Reconciler.longestIncreasingRun(new int[] {3, 0, 1, 4, 2});

    assertArrayEquals(new boolean[] {false, true, true, false, true}, stays);
  }

  private static List<Entry.Key> keys(String... ids) {
    List<Entry.Key> out = new ArrayList<>();
    for (String id : ids) out.add(Entry.Key.message(id));
    return out;
  }

  private static ThreadSnapshot snapshot(boolean typing, Message... messages) {
    List<Entry> entries = new ArrayList<>();
    for (Message m : messages) entries.add(Entry.of(m));
    return ThreadSnapshot.of(List.of(entries), typing);
  }
}
