package cafe.woden.chatlayout.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** A map pin. Rendered as a snapshot of {@code width x height}. */
@ValueObject
public record LocationItem(double latitude, double longitude, int width, int height) {

  public static final int DEFAULT_SIZE = 240;

  public LocationItem {
    if (latitude < -90 || latitude > 90) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (longitude < -180 || longitude > 180) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
    if (width <= 0) width = DEFAULT_SIZE;
    if (height <= 0) height = DEFAULT_SIZE;
  }

  public LocationItem(double latitude, double longitude) {
    this(latitude, longitude, DEFAULT_SIZE, DEFAULT_SIZE);
  }
}
