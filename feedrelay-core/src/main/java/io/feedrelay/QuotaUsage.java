package io.feedrelay;

/**
 * Current usage counts read inside an admission transaction.
 *
 * @param destinationSubscriptions subscriptions held by the destination
 * @param ownerFeeds               distinct feeds created by the owner
 * @param ownerSubscriptions       subscriptions created by the owner
 */
public record QuotaUsage(int destinationSubscriptions, int ownerFeeds, int ownerSubscriptions) {}
