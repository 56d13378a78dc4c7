package cafe.woden.chatlayout.reconcile;

import cafe.woden.chatlayout.layout.LayoutEngine;
import cafe.woden.chatlayout.layout.LayoutPreconditionException;
import cafe.woden.chatlayout.layout.ThreadSnapshot;
import cafe.woden.chatlayout.model.Entry;
import cafe.woden.chatlayout.reconcile.api.ThreadPresenter;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the current thread from the bound message source, decides how to present the difference
 * and applies it.
 *
 * <p>Order of an update: read source, plan, drop stale cached layouts, install the new snapshot in
 * the engine, hand the plan to the presenter, run the completion callback. Must be driven from the
 * layout thread; calling {@link #update} again from inside the presenter or a completion callback
 * fails.
 *
 * <p>{@link #isTypingIndicatorVisible()} always matches the snapshot installed in the engine. A
 * toggle whose update fails leaves it unchanged, so the same toggle can be retried.
 */
public class ThreadUpdateCoordinator {

  private static final Logger log = LoggerFactory.getLogger(ThreadUpdateCoordinator.class);

  private final LayoutEngine engine;
  private final Reconciler reconciler;

  private ThreadPresenter presenter;
  private boolean typingIndicatorVisible;
  private boolean applying;

  public ThreadUpdateCoordinator(LayoutEngine engine, Reconciler reconciler) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
  }

  public void bindPresenter(ThreadPresenter presenter) {
    this.presenter = Objects.requireNonNull(presenter, "presenter");
  }

  public boolean isTypingIndicatorVisible() {
    return typingIndicatorVisible;
  }

  public UpdatePlan setTypingIndicatorVisible(boolean visible) {
    return setTypingIndicatorVisible(visible, null);
  }

  /** Shows or hides the typing indicator. A no-op plan is returned when nothing changes. */
  public UpdatePlan setTypingIndicatorVisible(boolean visible, Runnable completion) {
    if (visible == typingIndicatorVisible) {
      if (completion != null) completion.run();
      return UpdatePlan.noOp();
    }
    return run(visible, completion);
  }

  public UpdatePlan update() {
    return update(null);
  }

  /** Re-reads the source and applies whatever changed. */
  public UpdatePlan update(Runnable completion) {
    return run(typingIndicatorVisible, completion);
  }

  private UpdatePlan run(boolean typingIndicator, Runnable completion) {
    if (applying) {
      throw new IllegalStateException("thread update already in progress");
    }
    ThreadPresenter p = presenter;
    if (p == null) {
      throw LayoutPreconditionException.missing(LayoutPreconditionException.Missing.PRESENTER);
    }

    applying = true;
    try {
      ThreadSnapshot previous = engine.snapshot();
      ThreadSnapshot next = ThreadSnapshot.fromSource(engine.source(), typingIndicator);
      UpdatePlan plan = reconciler.plan(previous, next);
      apply(plan, p);
      if (completion != null) completion.run();
      return plan;
    } finally {
      applying = false;
    }
  }

  private void apply(UpdatePlan plan, ThreadPresenter p) {
    if (plan instanceof UpdatePlan.Structural s) {
      Set<Entry.Key> stale = new LinkedHashSet<>(s.removed());
      stale.addAll(s.changed());
      stale.addAll(s.moved());
      stale.forEach(this::invalidate);
      install(s.next());
      log.debug(
          "[reconcile] structural update: +{} -{} moved {} changed {}",
          s.inserted().size(),
          s.removed().size(),
          s.moved().size(),
          s.changed().size());
      p.applyStructural(s);
    } else if (plan instanceof UpdatePlan.SelectiveRefresh r) {
      r.keys().forEach(this::invalidate);
      install(r.next());
      log.debug("[reconcile] refreshing {} entr(ies)", r.refreshed().size());
      p.refresh(r);
    } else {
      log.trace("[reconcile] nothing changed");
    }
  }

  private void install(ThreadSnapshot next) {
    engine.install(next);
    typingIndicatorVisible = next.hasTypingIndicator();
  }

  // The typing indicator is never cached.
  private void invalidate(Entry.Key key) {
    if (key.isMessage()) engine.invalidate(key.id());
  }
}
