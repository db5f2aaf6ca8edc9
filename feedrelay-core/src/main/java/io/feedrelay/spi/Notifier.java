package io.feedrelay.spi;

/**
 * Delivers text to a destination (a chat, channel or similar).
 *
 * <p>Delivery is best-effort. Failures are logged by the caller and never retried
 * within the same update pass.
 */
@FunctionalInterface
public interface Notifier {

  /**
   * Sends one message.
   *
   * @param destinationId target destination
   * @param text          message text
   * @throws Exception if the message could not be handed to the transport
   */
  void send(long destinationId, String text) throws Exception;
}
