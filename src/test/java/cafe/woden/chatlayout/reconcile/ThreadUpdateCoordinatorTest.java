package cafe.woden.chatlayout.reconcile;

import static cafe.woden.chatlayout.layout.LayoutTestSupport.incoming;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import cafe.woden.chatlayout.layout.AttributesCache;
import cafe.woden.chatlayout.layout.FixedWidthTextMeasurer;
import cafe.woden.chatlayout.layout.InMemoryMessageSource;
import cafe.woden.chatlayout.layout.ItemPosition;
import cafe.woden.chatlayout.layout.LayoutEngine;
import cafe.woden.chatlayout.layout.LayoutPreconditionException;
import cafe.woden.chatlayout.layout.LayoutStyles;
import cafe.woden.chatlayout.layout.api.LayoutPolicy;
import cafe.woden.chatlayout.model.Entry;
import cafe.woden.chatlayout.reconcile.api.ThreadPresenter;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ThreadUpdateCoordinatorTest {

  private InMemoryMessageSource source;
  private LayoutEngine engine;
  private ThreadPresenter presenter;
  private ThreadUpdateCoordinator coordinator;

  @BeforeEach
  void setUp() {
    source = InMemoryMessageSource.of(incoming("m1", "hello"), incoming("m2", "world"));
    engine =
        new LayoutEngine(LayoutStyles.defaults(), new FixedWidthTextMeasurer(), new AttributesCache());
    engine.bind(source, LayoutPolicy.noCaptions());
    engine.setItemWidth(300);
    presenter = mock(ThreadPresenter.class);
    coordinator = new ThreadUpdateCoordinator(engine, new Reconciler());
    coordinator.bindPresenter(presenter);
  }

  @Test
  void firstUpdateInsertsEverythingAndInstallsSnapshot() {
    UpdatePlan plan = coordinator.update();

    UpdatePlan.Structural s = assertInstanceOf(UpdatePlan.Structural.class, plan);
    assertEquals(List.of(Entry.Key.message("m1"), Entry.Key.message("m2")), s.inserted());
    assertSame(s.next(), engine.snapshot());
    verify(presenter).applyStructural(s);
  }

  @Test
  void editRefreshesOnlyThatEntryAndDropsItsCachedLayout() {
    coordinator.update();
    engine.attributesAt(ItemPosition.of(0, 0));
    engine.attributesAt(ItemPosition.of(0, 1));

    source.replace(incoming("m2", "world, edited"));
    UpdatePlan plan = coordinator.update();

    UpdatePlan.SelectiveRefresh r = assertInstanceOf(UpdatePlan.SelectiveRefresh.class, plan);
    assertEquals(List.of(Entry.Key.message("m2")), r.keys());
    assertEquals(1, engine.cache().size());
    verify(presenter).refresh(r);
  }

  @Test
  void unchangedSourceTouchesNothing() {
    coordinator.update();

    UpdatePlan plan = coordinator.update();

    assertSame(UpdatePlan.noOp(), plan);
    verify(presenter, never()).refresh(any());
  }

  @Test
  void typingIndicatorToggleIsStructuralAndIdempotent() {
    coordinator.update();

    UpdatePlan shown = coordinator.setTypingIndicatorVisible(true);
    UpdatePlan again = coordinator.setTypingIndicatorVisible(true);

    assertInstanceOf(UpdatePlan.Structural.class, shown);
    assertSame(UpdatePlan.noOp(), again);
    assertTrue(coordinator.isTypingIndicatorVisible());
    assertTrue(engine.snapshot().hasTypingIndicator());

    coordinator.setTypingIndicatorVisible(false);
    assertFalse(engine.snapshot().hasTypingIndicator());
  }

  @Test
  void failedToggleLeavesIndicatorHiddenAndCanBeRetried() {
    ThreadUpdateCoordinator unbound = new ThreadUpdateCoordinator(engine, new Reconciler());

    assertThrows(LayoutPreconditionException.class, () -> unbound.setTypingIndicatorVisible(true));
    assertFalse(unbound.isTypingIndicatorVisible());
    assertFalse(engine.snapshot().hasTypingIndicator());

    unbound.bindPresenter(presenter);
    UpdatePlan.Structural s =
        assertInstanceOf(UpdatePlan.Structural.class, unbound.setTypingIndicatorVisible(true));

    assertTrue(s.inserted().contains(Entry.Key.TYPING_INDICATOR));
    assertTrue(unbound.isTypingIndicatorVisible());
    assertTrue(engine.snapshot().hasTypingIndicator());
  }

  @Test
  void toggleRejectedDuringPresenterCallbackKeepsFlagInSyncWithSnapshot() {
    coordinator.update();
    doAnswer(
            inv -> {
              assertThrows(
                  IllegalStateException.class, () -> coordinator.setTypingIndicatorVisible(true));
              return null;
            })
        .when(presenter)
        .applyStructural(any());

    source.append(incoming("m3", "again"));
    coordinator.update();

    assertFalse(coordinator.isTypingIndicatorVisible());
    assertFalse(engine.snapshot().hasTypingIndicator());

    doAnswer(inv -> null).when(presenter).applyStructural(any());
    UpdatePlan retry = coordinator.setTypingIndicatorVisible(true);

    assertEquals(
        List.of(Entry.Key.TYPING_INDICATOR),
        assertInstanceOf(UpdatePlan.Structural.class, retry).inserted());
    assertTrue(engine.snapshot().hasTypingIndicator());
  }

  @Test
  void messageNamedLikeTheIndicatorCoexistsWithIt() {
    InMemoryMessageSource lookalike = InMemoryMessageSource.of(incoming("typingIndicator", "hi"));
    engine.bind(lookalike, LayoutPolicy.noCaptions());
    coordinator.update();
    coordinator.setTypingIndicatorVisible(true);
    engine.attributesAt(ItemPosition.of(0, 0));

    UpdatePlan hidden = coordinator.setTypingIndicatorVisible(false);

    UpdatePlan.Structural s = assertInstanceOf(UpdatePlan.Structural.class, hidden);
    assertEquals(List.of(Entry.Key.TYPING_INDICATOR), s.removed());
    assertTrue(engine.snapshot().contains(Entry.Key.message("typingIndicator")));
    // hiding the indicator must not drop the message's cached layout
    assertEquals(1, engine.cache().size());
  }

  @Test
  void completionRunsAfterPresenter() {
    Runnable completion = mock(Runnable.class);

    coordinator.update(completion);

    InOrder order = inOrder(presenter, completion);
    order.verify(presenter).applyStructural(any());
    order.verify(completion).run();
  }

  @Test
  void reentrantUpdateFromPresenterFails() {
    AtomicBoolean rejected = new AtomicBoolean();
    doAnswer(
            inv -> {
              assertThrows(IllegalStateException.class, coordinator::update);
              rejected.set(true);
              return null;
            })
        .when(presenter)
        .applyStructural(any());

    coordinator.update();

    assertTrue(rejected.get());
    // the guard is released once the pass completes
    source.append(incoming("m3", "again"));
    doAnswer(inv -> null).when(presenter).applyStructural(any());
    assertInstanceOf(UpdatePlan.Structural.class, coordinator.update());
  }

  @Test
  void missingPresenterIsAPreconditionFailure() {
    ThreadUpdateCoordinator unbound = new ThreadUpdateCoordinator(engine, new Reconciler());

    LayoutPreconditionException e =
        assertThrows(LayoutPreconditionException.class, unbound::update);

    assertEquals(LayoutPreconditionException.Missing.PRESENTER, e.missing());
    verifyNoInteractions(presenter);
  }
}
