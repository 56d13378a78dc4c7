package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.layout.api.MessageSource;
import cafe.woden.chatlayout.model.Entry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The ordered entries of a thread at one point in time, grouped in sections.
 *
 * <p>Entry keys are unique across the whole snapshot. When the typing indicator is shown it sits
 * alone in a trailing section.
 */
public final class ThreadSnapshot {

  private static final ThreadSnapshot EMPTY = new ThreadSnapshot(List.of(), false);

  private final List<List<Entry>> sections;
  private final boolean typingIndicatorSection;
  private final Map<Entry.Key, ItemPosition> positionsByKey;

  private ThreadSnapshot(List<List<Entry>> sections, boolean typingIndicatorSection) {
    this.sections = sections;
    this.typingIndicatorSection = typingIndicatorSection;
    this.positionsByKey = indexPositions(sections);
  }

  public static ThreadSnapshot empty() {
    return EMPTY;
  }

  /** Builds a snapshot from message sections, optionally appending the typing indicator. */
  public static ThreadSnapshot of(List<List<Entry>> messageSections, boolean typingIndicator) {
    List<List<Entry>> copy = new ArrayList<>(messageSections.size() + 1);
    for (List<Entry> section : messageSections) {
      for (Entry e : section) {
        if (e instanceof Entry.TypingIndicator) {
          throw new IllegalArgumentException("typing indicator must not appear in message sections");
        }
      }
      copy.add(List.copyOf(section));
    }
    if (typingIndicator) copy.add(List.of(Entry.typingIndicator()));
    return new ThreadSnapshot(Collections.unmodifiableList(copy), typingIndicator);
  }

  /** Reads every section and item from {@code source}. */
  public static ThreadSnapshot fromSource(MessageSource source, boolean typingIndicator) {
    int sectionCount = Math.max(0, source.sectionCount());
    List<List<Entry>> sections = new ArrayList<>(sectionCount);
    for (int section = 0; section < sectionCount; section++) {
      int items = Math.max(0, source.itemCount(section));
      List<Entry> entries = new ArrayList<>(items);
      for (int item = 0; item < items; item++) {
        entries.add(Entry.of(source.message(ItemPosition.of(section, item))));
      }
      sections.add(entries);
    }
    return of(sections, typingIndicator);
  }

  public int sectionCount() {
    return sections.size();
  }

  public int itemCount(int section) {
    if (section < 0 || section >= sections.size()) return 0;
    return sections.get(section).size();
  }

  public List<Entry> section(int section) {
    return sections.get(section);
  }

  public Entry entryAt(ItemPosition position) {
    if (position.section() >= sections.size()) {
      throw new IndexOutOfBoundsException("no section " + position.section());
    }
    List<Entry> s = sections.get(position.section());
    if (position.item() >= s.size()) {
      throw new IndexOutOfBoundsException("no item " + position);
    }
    return s.get(position.item());
  }

  public Optional<ItemPosition> positionOf(Entry.Key key) {
    return Optional.ofNullable(positionsByKey.get(key));
  }

  public boolean contains(Entry.Key key) {
    return positionsByKey.containsKey(key);
  }

  /** All entries in display order. */
  public List<Entry> entries() {
    List<Entry> out = new ArrayList<>(positionsByKey.size());
    for (List<Entry> s : sections) out.addAll(s);
    return out;
  }

  /** Entry keys in display order. */
  public Set<Entry.Key> keys() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(positionsByKey.keySet()));
  }

  public boolean hasTypingIndicator() {
    return typingIndicatorSection;
  }

  public boolean isTypingIndicatorSection(int section) {
    return typingIndicatorSection && section == sections.size() - 1;
  }

  public int size() {
    return positionsByKey.size();
  }

  public boolean isEmpty() {
    return positionsByKey.isEmpty();
  }

  private static Map<Entry.Key, ItemPosition> indexPositions(List<List<Entry>> sections) {
    Map<Entry.Key, ItemPosition> out = new LinkedHashMap<>();
    for (int s = 0; s < sections.size(); s++) {
      List<Entry> entries = sections.get(s);
      for (int i = 0; i < entries.size(); i++) {
        Entry.Key key = entries.get(i).key();
        ItemPosition prev = out.put(key, ItemPosition.of(s, i));
        if (prev != null) {
          throw new IllegalArgumentException(
              "duplicate entry '" + key + "' at " + prev + " and " + ItemPosition.of(s, i));
        }
      }
    }
    return Collections.unmodifiableMap(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ThreadSnapshot other)) return false;
    return typingIndicatorSection == other.typingIndicatorSection
        && sections.equals(other.sections);
  }

  @Override
  public int hashCode() {
    return sections.hashCode() * 31 + Boolean.hashCode(typingIndicatorSection);
  }

  @Override
  public String toString() {
    return "ThreadSnapshot{sections=" + sections.size() + ", entries=" + size() + "}";
  }
}
