package cafe.woden.chatlayout.model;

import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record ContactItem(
    String displayName, String initials, List<String> phoneNumbers, List<String> emails) {

  public ContactItem {
    displayName = Objects.toString(displayName, "").trim();
    phoneNumbers = phoneNumbers == null ? List.of() : List.copyOf(phoneNumbers);
    emails = emails == null ? List.of() : List.copyOf(emails);
    if (initials == null || initials.isBlank()) initials = initialsOf(displayName);
  }

  public ContactItem(String displayName) {
    this(displayName, null, List.of(), List.of());
  }

  private static String initialsOf(String name) {
    StringBuilder sb = new StringBuilder(2);
    for (String part : name.split("\\s+")) {
      if (part.isEmpty()) continue;
      sb.appendCodePoint(Character.toUpperCase(part.codePointAt(0)));
      if (sb.length() >= 2) break;
    }
    return sb.toString();
  }
}
