package cafe.woden.chatlayout.config;

import cafe.woden.chatlayout.layout.AttributesCache;
import cafe.woden.chatlayout.layout.AwtTextMeasurer;
import cafe.woden.chatlayout.layout.LayoutEngine;
import cafe.woden.chatlayout.layout.LayoutStyles;
import cafe.woden.chatlayout.layout.TextMeasurer;
import cafe.woden.chatlayout.memory.MemoryPressureMonitor;
import cafe.woden.chatlayout.reconcile.Reconciler;
import cafe.woden.chatlayout.reconcile.ThreadUpdateCoordinator;
import cafe.woden.chatlayout.util.LayoutSchedulers;
import io.reactivex.rxjava3.core.Scheduler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Layout engine wiring.
 *
 * <p>The engine is single-threaded. Style changes and memory pressure signals are marshalled onto
 * {@link #LAYOUT_SCHEDULER} before they touch it.
 */
@Configuration
public class LayoutConfig {
  public static final String LAYOUT_SCHEDULER = "layoutScheduler";

  @Bean(name = LAYOUT_SCHEDULER)
  public Scheduler layoutScheduler() {
    return LayoutSchedulers.layoutThread();
  }

  @Bean
  public TextMeasurer textMeasurer() {
    return new AwtTextMeasurer();
  }

  @Bean
  public LayoutStylesBus layoutStylesBus(ChatLayoutProperties props) {
    return new LayoutStylesBus(props);
  }

  @Bean
  public LayoutEngine layoutEngine(
      ChatLayoutProperties props,
      LayoutStylesBus stylesBus,
      TextMeasurer measurer,
      @Qualifier(LAYOUT_SCHEDULER) Scheduler layoutScheduler) {
    LayoutEngine engine =
        new LayoutEngine(stylesBus.get(), measurer, new AttributesCache(props.cache().maxEntries()));
    stylesBus.addListener(
        evt -> {
          if (!LayoutStylesBus.PROP_LAYOUT_STYLES.equals(evt.getPropertyName())) return;
          LayoutStyles next = (LayoutStyles) evt.getNewValue();
          layoutScheduler.scheduleDirect(() -> engine.setStyles(next));
        });
    return engine;
  }

  @Bean
  public Reconciler reconciler() {
    return new Reconciler();
  }

  @Bean
  public ThreadUpdateCoordinator threadUpdateCoordinator(
      LayoutEngine engine, Reconciler reconciler) {
    return new ThreadUpdateCoordinator(engine, reconciler);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  public MemoryPressureMonitor memoryPressureMonitor(
      ChatLayoutProperties props,
      LayoutEngine engine,
      @Qualifier(LAYOUT_SCHEDULER) Scheduler layoutScheduler) {
    ChatLayoutProperties.Memory memory = props.memory();
    return new MemoryPressureMonitor(
        engine, layoutScheduler, memory.usageThreshold(), memory.enabled());
  }
}
