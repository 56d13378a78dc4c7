package cafe.woden.chatlayout.model;

import java.awt.Font;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Text with font runs attached.
 *
 * <p>Runs are ordered, non-overlapping and cover {@code [0, text.length())} exactly; gaps are filled
 * with the font of the preceding run (or the first run for a leading gap) on construction.
 */
@ValueObject
public record StyledText(String text, List<Run> runs) {

  /** A font applied to {@code [start, end)}. */
  public record Run(int start, int end, Font font) {
    public Run {
      Objects.requireNonNull(font, "font");
      if (start < 0 || end < start) {
        throw new IllegalArgumentException("invalid run [" + start + ", " + end + ")");
      }
    }
  }

  public StyledText {
    if (text == null) text = "";
    runs = normalizeRuns(text.length(), runs);
  }

  public static StyledText plain(String text, Font font) {
    String t = Objects.toString(text, "");
    return new StyledText(t, List.of(new Run(0, t.length(), Objects.requireNonNull(font, "font"))));
  }

  public boolean isEmpty() {
    return text.isEmpty();
  }

  public int length() {
    return text.length();
  }

  /** Font in effect at {@code index}, or {@code null} if the text carries no runs. */
  public Font fontAt(int index) {
    for (Run r : runs) {
      if (index >= r.start() && index < r.end()) return r.font();
    }
    return runs.isEmpty() ? null : runs.get(0).font();
  }

  private static List<Run> normalizeRuns(int length, List<Run> raw) {
    if (raw == null || raw.isEmpty()) return List.of();
    List<Run> sorted = new ArrayList<>(raw);
    sorted.sort((a, b) -> Integer.compare(a.start(), b.start()));

    List<Run> out = new ArrayList<>(sorted.size() + 1);
    int cursor = 0;
    Font carry = sorted.get(0).font();
    for (Run r : sorted) {
      int start = Math.min(Math.max(r.start(), cursor), length);
      int end = Math.min(r.end(), length);
      if (start > cursor) out.add(new Run(cursor, start, carry));
      if (end > start) {
        out.add(new Run(start, end, r.font()));
        cursor = end;
      }
      carry = r.font();
    }
    if (cursor < length) out.add(new Run(cursor, length, carry));
    if (out.isEmpty()) out.add(new Run(0, length, carry));
    return List.copyOf(out);
  }
}
