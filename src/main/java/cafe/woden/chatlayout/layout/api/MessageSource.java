package cafe.woden.chatlayout.layout.api;

import cafe.woden.chatlayout.layout.ItemPosition;
import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.StyledText;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Supplies the messages of one thread.
 *
 * <p>Answers must stay consistent for the duration of one update pass.
 */
@ApplicationLayer
public interface MessageSource {

  int sectionCount();

  int itemCount(int section);

  Message message(ItemPosition position);

  /** True when {@code message} was sent by the local user. */
  boolean isMine(Message message);

  /** Text for the inline timestamp label, measured into the attributes when present. */
  default Optional<StyledText> timestampLabelText(Message message, ItemPosition position) {
    return Optional.empty();
  }

  default int headerHeight(int section) {
    return 0;
  }

  default int footerHeight(int section) {
    return 0;
  }
}
