package cafe.woden.chatlayout.reconcile.api;

import cafe.woden.chatlayout.reconcile.UpdatePlan;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * The view that displays a thread. Receives each update plan after the layout engine already holds
 * the new snapshot, so any geometry it queries reflects the update.
 */
@ApplicationLayer
public interface ThreadPresenter {

  /** Entries were added, removed or moved: reload the structure, animating the listed ids. */
  void applyStructural(UpdatePlan.Structural plan);

  /** Redraw the listed entries in place. */
  void refresh(UpdatePlan.SelectiveRefresh plan);
}
