package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.StyledText;
import java.awt.font.FontRenderContext;
import java.awt.font.LineBreakMeasurer;
import java.awt.font.TextAttribute;
import java.awt.font.TextLayout;
import java.text.AttributedCharacterIterator;
import java.text.AttributedString;

/**
 * {@link TextMeasurer} backed by Java2D line breaking.
 *
 * <p>The render context is created once and shared by every call. The {@link AttributedString} and
 * {@link LineBreakMeasurer} are built per call: a measurer is bound to the iterator of one text and
 * Java2D has no way to rebind it, so there is nothing else to reuse across different texts. Repeat
 * measurements of the same message are avoided one level up, by {@link AttributesCache}.
 *
 * <p>Not thread-safe; layout runs on a single thread.
 */
public class AwtTextMeasurer implements TextMeasurer {

  private final FontRenderContext frc;

  public AwtTextMeasurer() {
    this(new FontRenderContext(null, true, true));
  }

  public AwtTextMeasurer(FontRenderContext frc) {
    this.frc = frc;
  }

  @Override
  public Size measure(StyledText text, int maxWidth) {
    if (text == null || text.isEmpty() || maxWidth <= 0) return Size.ZERO;

    AttributedString as = new AttributedString(text.text());
    for (StyledText.Run r : text.runs()) {
      if (r.end() > r.start()) {
        as.addAttribute(TextAttribute.FONT, r.font(), r.start(), r.end());
      }
    }

    float width = 0f;
    float height = 0f;
    String s = text.text();
    int paragraphStart = 0;
    while (paragraphStart <= s.length()) {
      int nl = s.indexOf('\n', paragraphStart);
      int paragraphEnd = nl < 0 ? s.length() : nl;

      if (paragraphEnd == paragraphStart) {
        // Blank line: reserve the height of the font in effect there.
        height += blankLineHeight(text, paragraphStart);
      } else {
        AttributedCharacterIterator it = as.getIterator(null, paragraphStart, paragraphEnd);
        LineBreakMeasurer lbm = new LineBreakMeasurer(it, frc);
        lbm.setPosition(paragraphStart);
        while (lbm.getPosition() < paragraphEnd) {
          TextLayout line = lbm.nextLayout(maxWidth, paragraphEnd, false);
          if (line == null) break;
          width = Math.max(width, line.getAdvance());
          height += line.getAscent() + line.getDescent() + line.getLeading();
        }
      }

      if (nl < 0) break;
      paragraphStart = nl + 1;
    }

    int w = Math.min(maxWidth, (int) Math.ceil(width));
    return new Size(w, (int) Math.ceil(height));
  }

  private float blankLineHeight(StyledText text, int index) {
    var font = text.fontAt(Math.min(index, Math.max(0, text.length() - 1)));
    if (font == null) return 0f;
    var lm = font.getLineMetrics(" ", frc);
    return lm.getAscent() + lm.getDescent() + lm.getLeading();
  }
}
