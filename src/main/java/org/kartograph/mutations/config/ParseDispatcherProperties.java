package org.kartograph.mutations.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for live parse feedback.
 *
 * <p>Inputs up to {@code backgroundThreshold} characters are parsed synchronously. Larger
 * inputs are parsed on the background worker after a size-dependent debounce. Inputs above
 * {@code summaryThreshold} get a read-only breakdown instead of full linting.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "kartograph.parse-dispatcher")
public class ParseDispatcherProperties {

  /**
   * Largest input (in characters) parsed synchronously.
   */
  @Positive
  private int backgroundThreshold = 100_000;

  /**
   * Largest input (in characters) that still gets full linting.
   */
  @Positive
  private int summaryThreshold = 5_000_000;

  @Positive
  private long debounceSmallMs = 300;

  @Positive
  private long debounceMediumMs = 500;

  @Positive
  private long debounceLargeMs = 1000;

  /**
   * Inputs above this size use the medium debounce.
   */
  @Positive
  private int mediumSize = 1_000_000;

  /**
   * Inputs above this size use the large debounce.
   */
  @Positive
  private int largeSize = 10_000_000;

  /**
   * Operations included in a background preview.
   */
  @Positive
  private int previewLimit = 200;

  /**
   * Warning entries kept in a preview.
   */
  @Positive
  private int warningLimit = 1000;

  /**
   * Errors kept in a read-only breakdown.
   */
  @Positive
  private int summaryErrorLimit = 100;

  /**
   * Minutes of inactivity after which an editing session is dropped.
   */
  @Positive
  private int sessionTtlMinutes = 30;

  @Positive
  private int maxSessions = 1000;

  /**
   * Debounce delay for an input of the given size.
   *
   * @param size input length in characters
   * @return delay in milliseconds
   */
  public long debounceFor(int size) {
    if (size > largeSize) {
      return debounceLargeMs;
    }
    if (size > mediumSize) {
      return debounceMediumMs;
    }
    return debounceSmallMs;
  }

  public int getBackgroundThreshold() {
    return backgroundThreshold;
  }

  public void setBackgroundThreshold(int backgroundThreshold) {
    this.backgroundThreshold = backgroundThreshold;
  }

  public int getSummaryThreshold() {
    return summaryThreshold;
  }

  public void setSummaryThreshold(int summaryThreshold) {
    this.summaryThreshold = summaryThreshold;
  }

  public long getDebounceSmallMs() {
    return debounceSmallMs;
  }

  public void setDebounceSmallMs(long debounceSmallMs) {
    this.debounceSmallMs = debounceSmallMs;
  }

  public long getDebounceMediumMs() {
    return debounceMediumMs;
  }

  public void setDebounceMediumMs(long debounceMediumMs) {
    this.debounceMediumMs = debounceMediumMs;
  }

  public long getDebounceLargeMs() {
    return debounceLargeMs;
  }

  public void setDebounceLargeMs(long debounceLargeMs) {
    this.debounceLargeMs = debounceLargeMs;
  }

  public int getMediumSize() {
    return mediumSize;
  }

  public void setMediumSize(int mediumSize) {
    this.mediumSize = mediumSize;
  }

  public int getLargeSize() {
    return largeSize;
  }

  public void setLargeSize(int largeSize) {
    this.largeSize = largeSize;
  }

  public int getPreviewLimit() {
    return previewLimit;
  }

  public void setPreviewLimit(int previewLimit) {
    this.previewLimit = previewLimit;
  }

  public int getWarningLimit() {
    return warningLimit;
  }

  public void setWarningLimit(int warningLimit) {
    this.warningLimit = warningLimit;
  }

  public int getSummaryErrorLimit() {
    return summaryErrorLimit;
  }

  public void setSummaryErrorLimit(int summaryErrorLimit) {
    this.summaryErrorLimit = summaryErrorLimit;
  }

  public int getSessionTtlMinutes() {
    return sessionTtlMinutes;
  }

  public void setSessionTtlMinutes(int sessionTtlMinutes) {
    this.sessionTtlMinutes = sessionTtlMinutes;
  }

  public int getMaxSessions() {
    return maxSessions;
  }

  public void setMaxSessions(int maxSessions) {
    this.maxSessions = maxSessions;
  }
}
