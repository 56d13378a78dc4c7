package cafe.woden.chatlayout.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A link preview card attached to a text message.
 *
 * <p>{@code attributedText} wins over {@code text} when present.
 */
@ValueObject
public record LinkItem(
    String text,
    StyledText attributedText,
    String url,
    String title,
    String teaser,
    String thumbnailUrl) {

  public LinkItem {
    text = Objects.toString(text, "");
    url = Objects.toString(url, "").trim();
    title = blankToNull(title);
    teaser = blankToNull(teaser);
    thumbnailUrl = blankToNull(thumbnailUrl);
  }

  /** Host shown under the teaser, e.g. {@code example.com}. Empty when the url has none. */
  public String domain() {
    if (url.isEmpty()) return "";
    try {
      String host = URI.create(url).getHost();
      if (host == null) return "";
      host = host.toLowerCase(Locale.ROOT);
      return host.startsWith("www.") ? host.substring(4) : host;
    } catch (IllegalArgumentException e) {
      return "";
    }
  }

  private static String blankToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
