/**
 * Removal of feeds that fail to load repeatedly within a rolling window.
 */
package io.feedrelay.quarantine;
