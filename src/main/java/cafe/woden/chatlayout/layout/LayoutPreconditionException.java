package cafe.woden.chatlayout.layout;

import java.util.Locale;
import java.util.Objects;

/**
 * A required collaborator is missing or cannot handle the request. Layout refuses to continue
 * since any geometry it produced would be meaningless.
 */
public class LayoutPreconditionException extends IllegalStateException {

  public enum Missing {
    MESSAGE_SOURCE,
    LAYOUT_POLICY,
    SIZE_CALCULATOR,
    PRESENTER
  }

  private final Missing missing;

  public LayoutPreconditionException(Missing missing, String message) {
    super(message);
    this.missing = Objects.requireNonNull(missing, "missing");
  }

  public static LayoutPreconditionException missing(Missing missing) {
    String what = missing.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    return new LayoutPreconditionException(
        missing, "layout precondition failed: no " + what + " bound");
  }

  public Missing missing() {
    return missing;
  }
}
