package cafe.woden.chatlayout.memory;

import cafe.woden.chatlayout.layout.LayoutEngine;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryNotificationInfo;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.MemoryUsage;
import java.util.Objects;
import javax.management.ListenerNotFoundException;
import javax.management.Notification;
import javax.management.NotificationEmitter;
import javax.management.NotificationListener;
import javax.management.openmbean.CompositeData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops every cached layout when the heap runs low.
 *
 * <p>Heap pools that support usage thresholds get one at {@code thresholdFraction} of their max.
 * Crossings arrive on a JMX notification thread; they are republished through a processor and
 * handled on the layout scheduler, so the engine is only ever touched from its own thread. A burst
 * of signals collapses into one pending invalidation.
 */
public class MemoryPressureMonitor implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(MemoryPressureMonitor.class);

  public static final double DEFAULT_THRESHOLD_FRACTION = 0.85;

  private final LayoutEngine engine;
  private final Scheduler layoutScheduler;
  private final double thresholdFraction;
  private final boolean watchHeap;

  private final FlowableProcessor<String> signals = PublishProcessor.<String>create().toSerialized();
  private final NotificationListener listener = this::onNotification;

  private Disposable subscription;
  private NotificationEmitter emitter;

  public MemoryPressureMonitor(
      LayoutEngine engine, Scheduler layoutScheduler, double thresholdFraction, boolean watchHeap) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.layoutScheduler = Objects.requireNonNull(layoutScheduler, "layoutScheduler");
    if (!(thresholdFraction > 0.0 && thresholdFraction < 1.0)) {
      throw new IllegalArgumentException(
          "thresholdFraction must be in (0, 1), got " + thresholdFraction);
    }
    this.thresholdFraction = thresholdFraction;
    this.watchHeap = watchHeap;
  }

  public Flowable<String> signals() {
    return signals.onBackpressureLatest();
  }

  public synchronized void start() {
    if (subscription != null) return;
    subscription =
        signals()
            .observeOn(layoutScheduler)
            .subscribe(
                this::invalidate,
                err -> log.warn("[memory] pressure signal stream failed", err));
    if (watchHeap) installHeapThresholds();
  }

  /** Reports memory pressure from outside the JVM's own pool notifications. */
  public void signal(String reason) {
    signals.onNext(Objects.requireNonNullElse(reason, "unspecified"));
  }

  public synchronized boolean isRunning() {
    return subscription != null && !subscription.isDisposed();
  }

  @Override
  public synchronized void close() {
    if (emitter != null) {
      try {
        emitter.removeNotificationListener(listener);
      } catch (ListenerNotFoundException e) {
        log.debug("[memory] threshold listener was already removed", e);
      }
      emitter = null;
    }
    if (subscription != null) {
      subscription.dispose();
      subscription = null;
    }
  }

  private void invalidate(String reason) {
    int dropped = engine.invalidateLayout();
    log.info("[memory] {}: dropped {} cached layout(s)", reason, dropped);
  }

  private void installHeapThresholds() {
    int armed = 0;
    for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
      if (pool.getType() != MemoryType.HEAP || !pool.isUsageThresholdSupported()) continue;
      long max = pool.getUsage().getMax();
      if (max <= 0) continue;
      pool.setUsageThreshold((long) (max * thresholdFraction));
      armed++;
    }
    if (armed == 0) {
      log.info("[memory] no heap pool supports usage thresholds; relying on explicit signals");
      return;
    }
    if (ManagementFactory.getMemoryMXBean() instanceof NotificationEmitter e) {
      e.addNotificationListener(listener, null, null);
      emitter = e;
      log.debug("[memory] watching {} heap pool(s) at {}", armed, thresholdFraction);
    }
  }

  private void onNotification(Notification notification, Object handback) {
    if (!MemoryNotificationInfo.MEMORY_THRESHOLD_EXCEEDED.equals(notification.getType())) return;
    String reason = "heap usage threshold exceeded";
    Object data = notification.getUserData();
    if (data instanceof CompositeData cd) {
      MemoryNotificationInfo info = MemoryNotificationInfo.from(cd);
      MemoryUsage usage = info.getUsage();
      reason = "pool " + info.getPoolName() + " at " + usage.getUsed() + "/" + usage.getMax();
    }
    signal(reason);
  }
}
