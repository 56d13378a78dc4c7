package cafe.woden.chatlayout.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A photo or video reference with its natural display size. */
@ValueObject
public record MediaItem(String url, int width, int height, String placeholder) {

  public static final int DEFAULT_SIZE = 240;

  public MediaItem {
    url = Objects.toString(url, "");
    placeholder = Objects.toString(placeholder, "");
    if (width <= 0) width = DEFAULT_SIZE;
    if (height <= 0) height = DEFAULT_SIZE;
  }

  public MediaItem(String url) {
    this(url, DEFAULT_SIZE, DEFAULT_SIZE, "");
  }
}
