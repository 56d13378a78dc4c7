package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.layout.api.LayoutPolicy;
import cafe.woden.chatlayout.layout.api.MessageSource;
import cafe.woden.chatlayout.model.Entry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the entries currently on screen and answers per-position geometry for them.
 *
 * <p>Message attributes go through an {@link AttributesCache}; the typing indicator is cheap and
 * always recomputed. All methods must be called from the layout thread.
 */
public class LayoutEngine implements LayoutContext {

  private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

  private final TextMeasurer measurer;
  private final AttributesCache cache;
  private final CalculatorRegistry calculators;

  private MessageSource source;
  private LayoutPolicy policy;
  private LayoutStyles styles;
  private int itemWidth;
  private ThreadSnapshot snapshot = ThreadSnapshot.empty();

  public LayoutEngine(LayoutStyles styles, TextMeasurer measurer, AttributesCache cache) {
    this.styles = Objects.requireNonNull(styles, "styles");
    this.measurer = Objects.requireNonNull(measurer, "measurer");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.calculators = new CalculatorRegistry(this);
  }

  /** Binds the collaborators. Any cached geometry from a previous binding is dropped. */
  public void bind(MessageSource source, LayoutPolicy policy) {
    this.source = Objects.requireNonNull(source, "source");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.snapshot = ThreadSnapshot.empty();
    cache.invalidateAll();
  }

  public boolean isBound() {
    return source != null && policy != null;
  }

  @Override
  public MessageSource source() {
    if (source == null) {
      throw LayoutPreconditionException.missing(LayoutPreconditionException.Missing.MESSAGE_SOURCE);
    }
    return source;
  }

  @Override
  public LayoutPolicy policy() {
    if (policy == null) {
      throw LayoutPreconditionException.missing(LayoutPreconditionException.Missing.LAYOUT_POLICY);
    }
    return policy;
  }

  @Override
  public LayoutStyles styles() {
    return styles;
  }

  @Override
  public TextMeasurer measurer() {
    return measurer;
  }

  @Override
  public int itemWidth() {
    return itemWidth;
  }

  public CalculatorRegistry calculators() {
    return calculators;
  }

  /** Sets the width available to each cell. Negative widths clamp to zero. */
  public void setItemWidth(int width) {
    int w = Math.max(0, width);
    if (w == itemWidth) return;
    log.debug("[layout] item width {} -> {}", itemWidth, w);
    itemWidth = w;
    invalidateLayout();
  }

  public void setStyles(LayoutStyles next) {
    Objects.requireNonNull(next, "styles");
    if (next.equals(styles)) return;
    styles = next;
    invalidateLayout();
  }

  public ThreadSnapshot snapshot() {
    return snapshot;
  }

  /** Replaces the entries on screen. Called once per applied update. */
  public void install(ThreadSnapshot next) {
    this.snapshot = Objects.requireNonNull(next, "snapshot");
  }

  public LayoutAttributes attributesAt(ItemPosition position) {
    return attributesFor(snapshot.entryAt(position), position);
  }

  public Size cellSizeAt(ItemPosition position) {
    return attributesAt(position).cellSize();
  }

  /** Attributes for {@code entry} laid out at {@code position}, served from cache when valid. */
  public LayoutAttributes attributesFor(Entry entry, ItemPosition position) {
    Objects.requireNonNull(entry, "entry");
    SizeCalculator calculator = calculators.calculatorFor(entry);
    if (!(entry instanceof Entry.MessageEntry m)) {
      return calculator.computeAttributes(entry, position);
    }

    var cached = cache.get(m.message(), position);
    if (cached.isPresent()) return cached.get();

    LayoutAttributes computed = calculator.computeAttributes(entry, position);
    cache.put(m.message(), position, computed);
    return computed;
  }

  public Size headerSize(int section) {
    if (snapshot.isTypingIndicatorSection(section)) return Size.ZERO;
    return new Size(itemWidth, source().headerHeight(section));
  }

  public Size footerSize(int section) {
    if (snapshot.isTypingIndicatorSection(section)) return Size.ZERO;
    return new Size(itemWidth, source().footerHeight(section));
  }

  /** Drops every cached attribute; the next lookup for any message recomputes. */
  public int invalidateLayout() {
    int dropped = cache.size();
    cache.invalidateAll();
    log.debug("[layout] invalidated {} cached layout(s)", dropped);
    return dropped;
  }

  public boolean invalidate(String messageId) {
    return cache.invalidate(messageId);
  }

  public AttributesCache cache() {
    return cache;
  }
}
