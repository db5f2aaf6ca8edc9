package io.feedrelay;

import java.time.Instant;

/**
 * Delivery candidate for a feed: a destination and the publish time of the last
 * item it has already received.
 */
public record Subscriber(long destinationId, Instant lastUpdate) {}
