package cafe.woden.chatlayout.layout;

import static cafe.woden.chatlayout.layout.LayoutTestSupport.ITEM_WIDTH;
import static cafe.woden.chatlayout.layout.LayoutTestSupport.boundEngine;
import static cafe.woden.chatlayout.layout.LayoutTestSupport.incoming;
import static org.junit.jupiter.api.Assertions.assertEquals;

import cafe.woden.chatlayout.layout.api.LayoutPolicy;
import cafe.woden.chatlayout.model.Entry;
import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.MessageKind;
import cafe.woden.chatlayout.model.StyledText;
import java.awt.Font;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class SystemAndTypingIndicatorTest {

  @Test
  void systemMessageSpansTheRowWithFixedPadding() {
    Font italic = new Font(Font.DIALOG, Font.ITALIC, 13);
    Message m =
        new Message(
            "s1",
            InMemoryMessageSource.THEM,
            new MessageKind.System(StyledText.plain("Today", italic)));
    LayoutEngine engine = boundEngine(InMemoryMessageSource.of(m), LayoutPolicy.noCaptions());

    LayoutAttributes attrs = engine.attributesAt(ItemPosition.of(0, 0));

    assertEquals(new Size(ITEM_WIDTH, 20), attrs.messageContainerSize());
    assertEquals(new Size(ITEM_WIDTH, 20 + 16), attrs.cellSize());
    assertEquals(new EdgeInsets(8, 16, 8, 16), attrs.messageContainerPadding());
    assertEquals(Size.ZERO, attrs.avatarSize());
    assertEquals(italic, attrs.messageLabelFont());
  }

  @Test
  void typingIndicatorUsesDefaultHeight() {
    InMemoryMessageSource source = InMemoryMessageSource.of(incoming("m1", "hi"));
    LayoutEngine engine = boundEngine(source, LayoutPolicy.noCaptions());
    engine.install(ThreadSnapshot.fromSource(source, true));

    Size cell = engine.cellSizeAt(ItemPosition.of(1, 0));

    assertEquals(new Size(ITEM_WIDTH, LayoutStyles.DEFAULT_TYPING_INDICATOR_HEIGHT), cell);
    assertEquals(Size.ZERO, engine.headerSize(1));
    assertEquals(Size.ZERO, engine.footerSize(1));
  }

  @Test
  void typingIndicatorHeightCanBeOverriddenAndIsNeverCached() {
    InMemoryMessageSource source = InMemoryMessageSource.of(incoming("m1", "hi"));
    LayoutPolicy policy =
        new MessageSizeCalculatorTest.CaptionPolicy(0, 0, 0, 0) {
          @Override
          public OptionalInt typingIndicatorHeight(ItemPosition position) {
            return OptionalInt.of(40);
          }
        };
    LayoutEngine engine = boundEngine(source, policy);

    LayoutAttributes attrs =
        engine.attributesFor(Entry.typingIndicator(), ItemPosition.of(1, 0));

    assertEquals(new Size(ITEM_WIDTH, 40), attrs.cellSize());
    assertEquals(0, engine.cache().size());
  }

  @Test
  void typingIndicatorInsetsAddToHeight() {
    InMemoryMessageSource source = new InMemoryMessageSource();
    source.setSections(List.of());
    LayoutEngine engine = boundEngine(source, LayoutPolicy.noCaptions());
    engine.setStyles(
        new LayoutStyles(null, null, 0, null, null, 50, new EdgeInsets(5, 10, 5, 10), null));

    LayoutAttributes attrs =
        engine.attributesFor(Entry.typingIndicator(), ItemPosition.of(0, 0));

    assertEquals(new Size(ITEM_WIDTH, 60), attrs.cellSize());
    assertEquals(new Size(ITEM_WIDTH - 20, 50), attrs.messageContainerSize());
  }
}
