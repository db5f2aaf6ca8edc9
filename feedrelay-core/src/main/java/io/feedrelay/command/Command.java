package io.feedrelay.command;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed slash command from an inbound message.
 *
 * @param ownerId       id of the user who sent the message
 * @param ownerName     user name of the sender, used for the allow-list (may be empty)
 * @param destinationId chat the message was sent in
 * @param name          lower-case command name without the leading slash or bot suffix
 * @param arguments     remaining text, trimmed
 */
public record Command(long ownerId, String ownerName, long destinationId, String name, String arguments) {

  public Command {
    ownerName = ownerName == null ? "" : ownerName;
    Objects.requireNonNull(name, "name");
    arguments = arguments == null ? "" : arguments.trim();
  }

  /**
   * Parses message text such as {@code /addfeed@relaybot https://example.org/rss}.
   *
   * @return the command, or empty if the text is not a command
   */
  public static Optional<Command> parse(long ownerId, String ownerName, long destinationId, String text) {
    if (text == null) {
      return Optional.empty();
    }
    String trimmed = text.trim();
    if (trimmed.length() < 2 || trimmed.charAt(0) != '/') {
      return Optional.empty();
    }
    int space = indexOfWhitespace(trimmed);
    String head = space < 0 ? trimmed.substring(1) : trimmed.substring(1, space);
    String rest = space < 0 ? "" : trimmed.substring(space + 1);
    int at = head.indexOf('@');
    if (at >= 0) {
      head = head.substring(0, at);
    }
    if (head.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new Command(ownerId, ownerName, destinationId, head.toLowerCase(Locale.ROOT), rest));
  }

  private static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
