/**
 * Service provider interfaces: storage ({@link io.feedrelay.spi.SubscriptionStore},
 * {@link io.feedrelay.spi.ConnectionProvider}), external collaborators
 * ({@link io.feedrelay.spi.FeedSource}, {@link io.feedrelay.spi.Notifier}) and
 * observability ({@link io.feedrelay.spi.MetricsExporter}).
 */
package io.feedrelay.spi;
