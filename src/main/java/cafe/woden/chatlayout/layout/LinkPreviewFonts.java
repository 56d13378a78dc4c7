package cafe.woden.chatlayout.layout;

import java.awt.Font;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record LinkPreviewFonts(Font titleFont, Font teaserFont, Font domainFont) {

  public LinkPreviewFonts {
    Objects.requireNonNull(titleFont, "titleFont");
    Objects.requireNonNull(teaserFont, "teaserFont");
    Objects.requireNonNull(domainFont, "domainFont");
  }

  /** Derived from the body font: bold title one point down, teaser and domain two points down. */
  public static LinkPreviewFonts derivedFrom(Font body) {
    float base = body.getSize2D();
    return new LinkPreviewFonts(
        body.deriveFont(Font.BOLD, Math.max(1f, base - 1f)),
        body.deriveFont(Font.PLAIN, Math.max(1f, base - 2f)),
        body.deriveFont(Font.PLAIN, Math.max(1f, base - 2f)));
  }
}
