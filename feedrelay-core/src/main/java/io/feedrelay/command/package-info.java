/**
 * Chat command handling on top of {@link io.feedrelay.SubscriptionManager}.
 */
package io.feedrelay.command;
