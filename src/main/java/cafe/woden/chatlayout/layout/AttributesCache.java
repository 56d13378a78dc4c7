package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.Message;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU of computed attributes keyed by message id.
 *
 * <p>A lookup only hits when the cached message is content-equal to the current one and was laid
 * out at the same position; anything else is a miss and the caller recomputes. Confined to the
 * layout thread.
 */
public final class AttributesCache {

  public static final int DEFAULT_MAX_SIZE = 500;

  private final int maxSize;
  private final LinkedHashMap<String, CacheEntry> entries;
  private long hits;
  private long misses;

  public AttributesCache() {
    this(DEFAULT_MAX_SIZE);
  }

  public AttributesCache(int maxSize) {
    if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
    this.maxSize = maxSize;
    this.entries =
        new LinkedHashMap<>(Math.min(maxSize, 64), 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
            return size() > AttributesCache.this.maxSize;
          }
        };
  }

  public Optional<LayoutAttributes> get(Message message, ItemPosition position) {
    CacheEntry e = entries.get(message.id());
    if (e != null
        && e.fingerprint == message.contentFingerprint()
        && e.position.equals(position)
        && e.message.equals(message)) {
      hits++;
      return Optional.of(e.attributes);
    }
    misses++;
    return Optional.empty();
  }

  public void put(Message message, ItemPosition position, LayoutAttributes attributes) {
    entries.put(
        message.id(),
        new CacheEntry(message, message.contentFingerprint(), position, attributes));
  }

  /** Drops the entry for {@code messageId}. Returns true if one was cached. */
  public boolean invalidate(String messageId) {
    return entries.remove(messageId) != null;
  }

  public void invalidateAll() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  public int maxSize() {
    return maxSize;
  }

  public long hits() {
    return hits;
  }

  public long misses() {
    return misses;
  }

  private record CacheEntry(
      Message message, int fingerprint, ItemPosition position, LayoutAttributes attributes) {}
}
