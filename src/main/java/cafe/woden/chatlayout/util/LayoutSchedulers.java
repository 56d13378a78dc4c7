package cafe.woden.chatlayout.util;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import javax.swing.SwingUtilities;

/** RxJava scheduler for the thread that owns layout state: the Swing event dispatch thread. */
public final class LayoutSchedulers {
  private LayoutSchedulers() {}

  private static final Scheduler LAYOUT_THREAD = Schedulers.from(SwingUtilities::invokeLater);

  public static Scheduler layoutThread() {
    return LAYOUT_THREAD;
  }
}
