/**
 * Spring Boot auto-configuration for the feed relay.
 *
 * <p>Supply {@link io.feedrelay.spi.FeedSource} and {@link io.feedrelay.spi.Notifier} beans;
 * the store, connection provider, relay composite, subscription manager and command handler
 * are created from the {@code DataSource} and {@code feedrelay.*} properties.
 *
 * @see io.feedrelay.spring.boot.FeedRelayAutoConfiguration
 * @see io.feedrelay.spring.boot.FeedRelayProperties
 */
package io.feedrelay.spring.boot;
