package io.feedrelay.command;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandTest {

  @Test
  void parsesNameAndArguments() {
    Command command = Command.parse(7, "alice", 100, "/addfeed  https://example.org/rss ").orElseThrow();
    assertEquals("addfeed", command.name());
    assertEquals("https://example.org/rss", command.arguments());
    assertEquals(7, command.ownerId());
    assertEquals(100, command.destinationId());
  }

  @Test
  void stripsBotSuffixAndLowercases() {
    Command command = Command.parse(7, "alice", 100, "/RemoveFeed@relay_bot 2").orElseThrow();
    assertEquals("removefeed", command.name());
    assertEquals("2", command.arguments());
  }

  @Test
  void commandWithoutArguments() {
    Command command = Command.parse(7, null, 100, "/feeds").orElseThrow();
    assertEquals("feeds", command.name());
    assertEquals("", command.arguments());
    assertEquals("", command.ownerName());
  }

  @Test
  void nonCommandsIgnored() {
    assertEquals(Optional.empty(), Command.parse(7, "alice", 100, "hello"));
    assertEquals(Optional.empty(), Command.parse(7, "alice", 100, "/"));
    assertEquals(Optional.empty(), Command.parse(7, "alice", 100, "/@bot"));
    assertEquals(Optional.empty(), Command.parse(7, "alice", 100, null));
  }
}
