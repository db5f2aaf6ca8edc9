/**
 * Periodic update engine.
 *
 * @see io.feedrelay.update.FeedUpdater
 */
package io.feedrelay.update;
