package io.feedrelay.spring.boot;

import io.feedrelay.FeedRelay;
import io.feedrelay.QuotaLimits;
import io.feedrelay.SubscriptionManager;
import io.feedrelay.command.FeedCommands;
import io.feedrelay.jdbc.DataSourceConnectionProvider;
import io.feedrelay.jdbc.store.AbstractJdbcSubscriptionStore;
import io.feedrelay.jdbc.store.JdbcSubscriptionStores;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.FeedSource;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.spi.Notifier;
import io.feedrelay.update.ItemFormatter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the feed relay.
 *
 * <p>Always provides the JDBC {@link AbstractJdbcSubscriptionStore} (detected from the
 * {@link DataSource} URL) and a {@link ConnectionProvider}. The {@link FeedRelay} composite
 * is created once the application supplies a {@link FeedSource} and a {@link Notifier};
 * its update loop starts with the context unless {@code feedrelay.update.enabled=false}.
 *
 * @see FeedRelayProperties
 * @see FeedRelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(FeedRelay.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(FeedRelayProperties.class)
public class FeedRelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcSubscriptionStore subscriptionStore(DataSource dataSource) {
    return JdbcSubscriptionStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean({FeedSource.class, Notifier.class})
  public FeedRelay feedRelay(FeedRelayProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcSubscriptionStore subscriptionStore,
      FeedSource feedSource,
      Notifier notifier,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<ItemFormatter> formatterProvider) {

    var quota = props.getQuota();
    var update = props.getUpdate();
    var quarantine = props.getQuarantine();
    var commands = props.getCommands();

    var builder = FeedRelay.builder()
        .connectionProvider(connectionProvider)
        .store(subscriptionStore)
        .feedSource(feedSource)
        .notifier(notifier)
        .limits(new QuotaLimits(quota.getMaxFeedsPerDestination(),
            quota.getMaxTotalFeedsByOwner(), quota.getMaxActiveFeedsByOwner()))
        .interval(update.getInterval())
        .passTimeout(update.getPassTimeout())
        .initialDelay(update.getInitialDelay())
        .failureWindow(quarantine.getFailureWindow())
        .failureThreshold(quarantine.getFailureThreshold())
        .allowedOwners(commands.getAllowedOwners())
        .requestWindow(commands.getRequestWindow())
        .maxRequestsPerWindow(commands.getMaxRequestsPerWindow());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    ItemFormatter formatter = formatterProvider.getIfAvailable();
    if (formatter != null) {
      builder.formatter(formatter);
    }

    FeedRelay relay = builder.build();
    if (update.isEnabled()) {
      relay.start();
    }
    return relay;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(FeedRelay.class)
  public SubscriptionManager subscriptionManager(FeedRelay feedRelay) {
    return feedRelay.subscriptions();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(FeedRelay.class)
  public FeedCommands feedCommands(FeedRelay feedRelay) {
    return feedRelay.commands();
  }
}
