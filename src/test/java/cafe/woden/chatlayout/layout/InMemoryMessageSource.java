package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.layout.api.MessageSource;
import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.Sender;
import java.util.ArrayList;
import java.util.List;

/** Mutable sections of messages; messages from {@link #ME} count as mine. */
public final class InMemoryMessageSource implements MessageSource {

  public static final Sender ME = new Sender("me", "Me");
  public static final Sender THEM = new Sender("them", "Them");

  private final List<List<Message>> sections = new ArrayList<>();

  public static InMemoryMessageSource of(Message... messages) {
    InMemoryMessageSource source = new InMemoryMessageSource();
    source.setSections(List.of(List.of(messages)));
    return source;
  }

  public void setSections(List<List<Message>> next) {
    sections.clear();
    for (List<Message> s : next) sections.add(new ArrayList<>(s));
  }

  /** Replaces the message with the same id, wherever it is. */
  public void replace(Message edited) {
    for (List<Message> s : sections) {
      for (int i = 0; i < s.size(); i++) {
        if (s.get(i).id().equals(edited.id())) s.set(i, edited);
      }
    }
  }

  public void append(Message message) {
    if (sections.isEmpty()) sections.add(new ArrayList<>());
    sections.get(sections.size() - 1).add(message);
  }

  @Override
  public int sectionCount() {
    return sections.size();
  }

  @Override
  public int itemCount(int section) {
    return sections.get(section).size();
  }

  @Override
  public Message message(ItemPosition position) {
    return sections.get(position.section()).get(position.item());
  }

  @Override
  public boolean isMine(Message message) {
    return ME.equals(message.sender());
  }
}
