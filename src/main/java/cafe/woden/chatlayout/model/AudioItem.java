package cafe.woden.chatlayout.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record AudioItem(String url, double durationSeconds, int width, int height) {

  public static final int DEFAULT_WIDTH = 160;
  public static final int DEFAULT_HEIGHT = 35;

  public AudioItem {
    url = Objects.toString(url, "");
    if (durationSeconds < 0 || Double.isNaN(durationSeconds)) durationSeconds = 0;
    if (width <= 0) width = DEFAULT_WIDTH;
    if (height <= 0) height = DEFAULT_HEIGHT;
  }

  public AudioItem(String url, double durationSeconds) {
    this(url, durationSeconds, DEFAULT_WIDTH, DEFAULT_HEIGHT);
  }
}
