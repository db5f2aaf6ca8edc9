/**
 * Feed relay: polls subscribed feeds and delivers new items to chat destinations.
 *
 * <h2>Core Design</h2>
 * <p>Destinations subscribe to feeds through {@link io.feedrelay.SubscriptionManager}, whose
 * admission transaction enforces the {@linkplain io.feedrelay.QuotaLimits quota limits}
 * atomically. A scheduled {@linkplain io.feedrelay.update.FeedUpdater updater} fetches every
 * feed, delivers items newer than each subscription's progress marker in publish order and
 * advances the marker after each delivery. Feeds that keep failing are dropped by the
 * {@linkplain io.feedrelay.quarantine.QuarantinePolicy quarantine policy}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>feedrelay-core</b> - domain types, SPIs, admission, update engine, quarantine, commands (zero external deps)</li>
 *   <li><b>feedrelay-jdbc</b> - JDBC subscription store hierarchy (H2, MySQL, PostgreSQL)</li>
 *   <li><b>feedrelay-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>feedrelay-spring-boot-starter</b> - Spring Boot auto-configuration</li>
 * </ul>
 *
 * @see io.feedrelay.FeedRelay
 */
package io.feedrelay;
