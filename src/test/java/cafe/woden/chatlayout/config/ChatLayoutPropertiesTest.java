package cafe.woden.chatlayout.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.chatlayout.layout.AttributesCache;
import cafe.woden.chatlayout.layout.AvatarPosition;
import cafe.woden.chatlayout.layout.LayoutStyles;
import cafe.woden.chatlayout.layout.Size;
import java.beans.PropertyChangeListener;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ChatLayoutPropertiesTest {

  @Test
  void missingSectionsFallBackToDefaults() {
    ChatLayoutProperties props = new ChatLayoutProperties(null, null, null, null, null, null, null);

    assertEquals(AttributesCache.DEFAULT_MAX_SIZE, props.cache().maxEntries());
    assertTrue(props.memory().enabled());
    assertEquals(0.85, props.memory().usageThreshold());
    assertEquals(LayoutStyles.defaults(), props.toStyles());
  }

  @Test
  void invalidValuesAreReplaced() {
    ChatLayoutProperties props =
        new ChatLayoutProperties(
            new ChatLayoutProperties.Cache(-3),
            new ChatLayoutProperties.Memory(true, 4.0),
            new ChatLayoutProperties.Text(" ", 0),
            null,
            null,
            -1,
            new ChatLayoutProperties.TypingIndicator(0));

    assertEquals(AttributesCache.DEFAULT_MAX_SIZE, props.cache().maxEntries());
    assertEquals(0.85, props.memory().usageThreshold());
    assertEquals(0, props.avatarLeadingTrailingPadding());
    assertEquals(LayoutStyles.defaults(), props.toStyles());
  }

  @Test
  void directionOverridesApplyToThatDirectionOnly() {
    ChatLayoutProperties props =
        new ChatLayoutProperties(
            null,
            null,
            null,
            null,
            new ChatLayoutProperties.Direction(0, AvatarPosition.Vertical.MESSAGE_TOP),
            null,
            null);

    LayoutStyles styles = props.toStyles();

    assertEquals(Size.ZERO, styles.outgoing().avatarSize());
    assertEquals(AvatarPosition.Vertical.MESSAGE_TOP, styles.outgoing().avatarPosition().vertical());
    assertEquals(LayoutStyles.defaults().incoming(), styles.incoming());
  }

  @Test
  void busNotifiesListeners() {
    LayoutStylesBus bus = new LayoutStylesBus(null);
    AtomicReference<Object> seen = new AtomicReference<>();
    bus.addListener(evt -> seen.set(evt.getNewValue()));

    LayoutStyles next = bus.get().withAvatarLeadingTrailingPadding(12);
    bus.set(next);

    assertSame(next, seen.get());
    assertSame(next, bus.get());
  }

  @Test
  void removedListenerIsNoLongerNotified() {
    LayoutStylesBus bus = new LayoutStylesBus(null);
    AtomicInteger calls = new AtomicInteger();
    PropertyChangeListener l = evt -> calls.incrementAndGet();
    bus.addListener(l);

    bus.set(bus.get().withAvatarLeadingTrailingPadding(4));
    bus.removeListener(l);
    bus.set(bus.get().withAvatarLeadingTrailingPadding(8));

    assertEquals(1, calls.get());
  }
}
