package cafe.woden.chatlayout.layout.api;

import cafe.woden.chatlayout.layout.AccessoryPosition;
import cafe.woden.chatlayout.layout.AvatarPosition;
import cafe.woden.chatlayout.layout.ItemPosition;
import cafe.woden.chatlayout.layout.LabelAlignment;
import cafe.woden.chatlayout.layout.Size;
import cafe.woden.chatlayout.model.Message;
import java.util.Optional;
import java.util.OptionalInt;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Per-message sizing overrides supplied by the host.
 *
 * <p>Every {@code Optional} answer may be empty, meaning "no opinion": the calculator then uses the
 * {@link cafe.woden.chatlayout.layout.SizingConfiguration} of the sender direction. Caption label
 * heights have no such fallback and must always be answered.
 */
@ApplicationLayer
public interface LayoutPolicy {

  int cellTopLabelHeight(Message message, ItemPosition position);

  int messageTopLabelHeight(Message message, ItemPosition position);

  int messageBottomLabelHeight(Message message, ItemPosition position);

  int cellBottomLabelHeight(Message message, ItemPosition position);

  default Optional<Size> avatarSize(Message message, ItemPosition position) {
    return Optional.empty();
  }

  default Optional<AvatarPosition> avatarPosition(Message message, ItemPosition position) {
    return Optional.empty();
  }

  default Optional<LabelAlignment> cellTopLabelAlignment(Message message, ItemPosition position) {
    return Optional.empty();
  }

  default Optional<LabelAlignment> cellBottomLabelAlignment(
      Message message, ItemPosition position) {
    return Optional.empty();
  }

  default Optional<LabelAlignment> messageTopLabelAlignment(
      Message message, ItemPosition position) {
    return Optional.empty();
  }

  default Optional<LabelAlignment> messageBottomLabelAlignment(
      Message message, ItemPosition position) {
    return Optional.empty();
  }

  default Optional<Size> accessorySize(Message message, ItemPosition position) {
    return Optional.empty();
  }

  default Optional<AccessoryPosition> accessoryPosition(Message message, ItemPosition position) {
    return Optional.empty();
  }

  /**
   * Height of an inline attachment (thumbnail shown together with text) laid out at {@code
   * maxWidth}. Empty when the message has no attachment, or its content is not loaded yet.
   */
  default OptionalInt attachmentHeight(Message message, ItemPosition position, int maxWidth) {
    return OptionalInt.empty();
  }

  default OptionalInt typingIndicatorHeight(ItemPosition position) {
    return OptionalInt.empty();
  }

  /** Policy that never overrides anything and shows no caption labels. */
  static LayoutPolicy noCaptions() {
    return NoCaptions.INSTANCE;
  }

  final class NoCaptions implements LayoutPolicy {
    private static final NoCaptions INSTANCE = new NoCaptions();

    private NoCaptions() {}

    @Override
    public int cellTopLabelHeight(Message message, ItemPosition position) {
      return 0;
    }

    @Override
    public int messageTopLabelHeight(Message message, ItemPosition position) {
      return 0;
    }

    @Override
    public int messageBottomLabelHeight(Message message, ItemPosition position) {
      return 0;
    }

    @Override
    public int cellBottomLabelHeight(Message message, ItemPosition position) {
      return 0;
    }
  }
}
