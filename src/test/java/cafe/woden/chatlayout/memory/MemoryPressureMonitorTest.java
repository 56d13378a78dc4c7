package cafe.woden.chatlayout.memory;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import cafe.woden.chatlayout.layout.LayoutEngine;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import org.junit.jupiter.api.Test;

class MemoryPressureMonitorTest {

  private final LayoutEngine engine = mock(LayoutEngine.class);

  @Test
  void signalInvalidatesOnLayoutScheduler() {
    TestScheduler layoutThread = new TestScheduler();
    MemoryPressureMonitor monitor = new MemoryPressureMonitor(engine, layoutThread, 0.85, false);
    monitor.start();

    monitor.signal("test");
    verify(engine, never()).invalidateLayout();

    layoutThread.triggerActions();
    verify(engine, times(1)).invalidateLayout();
    monitor.close();
  }

  @Test
  void signalsAfterCloseAreIgnored() {
    MemoryPressureMonitor monitor =
        new MemoryPressureMonitor(engine, Schedulers.trampoline(), 0.85, false);
    monitor.start();
    assertTrue(monitor.isRunning());

    monitor.close();
    monitor.signal("late");

    assertFalse(monitor.isRunning());
    verify(engine, never()).invalidateLayout();
  }

  @Test
  void watchingHeapStartsAndStopsCleanly() {
    MemoryPressureMonitor monitor =
        new MemoryPressureMonitor(engine, Schedulers.trampoline(), 0.99, true);

    monitor.start();
    monitor.start();
    assertTrue(monitor.isRunning());
    monitor.close();
    monitor.close();

    assertFalse(monitor.isRunning());
  }

  @Test
  void thresholdMustBeAFraction() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new MemoryPressureMonitor(engine, Schedulers.trampoline(), 1.5, true));
    assertThrows(
        IllegalArgumentException.class,
        () -> new MemoryPressureMonitor(engine, Schedulers.trampoline(), 0.0, true));
  }
}
