package io.feedrelay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the feed relay.
 *
 * @see FeedRelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "feedrelay")
public class FeedRelayProperties {

  private final Quota quota = new Quota();
  private final Update update = new Update();
  private final Quarantine quarantine = new Quarantine();
  private final Commands commands = new Commands();
  private final Metrics metrics = new Metrics();

  public Quota getQuota() {
    return quota;
  }

  public Update getUpdate() {
    return update;
  }

  public Quarantine getQuarantine() {
    return quarantine;
  }

  public Commands getCommands() {
    return commands;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Admission limits; {@code 0} means unlimited.
   */
  public static class Quota {
    private int maxFeedsPerDestination = 10;
    private int maxTotalFeedsByOwner = 200;
    private int maxActiveFeedsByOwner = 20;

    public int getMaxFeedsPerDestination() {
      return maxFeedsPerDestination;
    }

    public void setMaxFeedsPerDestination(int maxFeedsPerDestination) {
      this.maxFeedsPerDestination = maxFeedsPerDestination;
    }

    public int getMaxTotalFeedsByOwner() {
      return maxTotalFeedsByOwner;
    }

    public void setMaxTotalFeedsByOwner(int maxTotalFeedsByOwner) {
      this.maxTotalFeedsByOwner = maxTotalFeedsByOwner;
    }

    public int getMaxActiveFeedsByOwner() {
      return maxActiveFeedsByOwner;
    }

    public void setMaxActiveFeedsByOwner(int maxActiveFeedsByOwner) {
      this.maxActiveFeedsByOwner = maxActiveFeedsByOwner;
    }
  }

  public static class Update {
    /**
     * Whether the update loop starts with the application context.
     */
    private boolean enabled = true;
    private Duration interval = Duration.ofHours(1);
    private Duration passTimeout = Duration.ofMinutes(1);
    private Duration initialDelay = Duration.ZERO;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public Duration getPassTimeout() {
      return passTimeout;
    }

    public void setPassTimeout(Duration passTimeout) {
      this.passTimeout = passTimeout;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }
  }

  public static class Quarantine {
    private Duration failureWindow = Duration.ofHours(12);
    /**
     * Failures within the window that drop a feed; {@code 0} disables quarantine.
     */
    private int failureThreshold = 9;

    public Duration getFailureWindow() {
      return failureWindow;
    }

    public void setFailureWindow(Duration failureWindow) {
      this.failureWindow = failureWindow;
    }

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }
  }

  public static class Commands {
    /**
     * Owner names allowed to add feeds; empty allows everyone.
     */
    private Set<String> allowedOwners = new LinkedHashSet<>();
    private Duration requestWindow = Duration.ofMinutes(1);
    /**
     * Commands per owner within the request window; {@code 0} means unlimited.
     */
    private int maxRequestsPerWindow = 0;

    public Set<String> getAllowedOwners() {
      return allowedOwners;
    }

    public void setAllowedOwners(Set<String> allowedOwners) {
      this.allowedOwners = allowedOwners;
    }

    public Duration getRequestWindow() {
      return requestWindow;
    }

    public void setRequestWindow(Duration requestWindow) {
      this.requestWindow = requestWindow;
    }

    public int getMaxRequestsPerWindow() {
      return maxRequestsPerWindow;
    }

    public void setMaxRequestsPerWindow(int maxRequestsPerWindow) {
      this.maxRequestsPerWindow = maxRequestsPerWindow;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "feedrelay";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
