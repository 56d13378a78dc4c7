package cafe.woden.chatlayout.config;

import cafe.woden.chatlayout.layout.LayoutStyles;
import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Objects;

/** Current {@link LayoutStyles}, with change notification for whoever has to re-lay out. */
public class LayoutStylesBus {

  public static final String PROP_LAYOUT_STYLES = "layoutStyles";

  private final PropertyChangeSupport pcs = new PropertyChangeSupport(this);
  private volatile LayoutStyles current;

  public LayoutStylesBus(ChatLayoutProperties props) {
    this.current = (props != null) ? props.toStyles() : LayoutStyles.defaults();
  }

  public LayoutStyles get() {
    return current;
  }

  public void set(LayoutStyles next) {
    Objects.requireNonNull(next, "styles");
    LayoutStyles prev = this.current;
    this.current = next;
    pcs.firePropertyChange(PROP_LAYOUT_STYLES, prev, next);
  }

  public void addListener(PropertyChangeListener l) {
    pcs.addPropertyChangeListener(l);
  }

  public void removeListener(PropertyChangeListener l) {
    pcs.removePropertyChangeListener(l);
  }
}
