package io.github.panghy.birpc.rpc;

/**
 * Configuration for service registration and dispatch.
 *
 * <p>The configuration covers:</p>
 * <ul>
 *   <li>Diagnostics - whether methods left out of a service are logged (default: on)</li>
 *   <li>Dispatch threads - the name prefix of threads the dispatcher creates (default: birpc-dispatch)</li>
 *   <li>Shutdown - how long closing a dispatcher waits for in-flight calls (default: 5s)</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RpcConfiguration config = RpcConfiguration.builder()
 *     .reportMethodExclusions(false)
 *     .dispatchThreadNamePrefix("calc-rpc")
 *     .shutdownTimeoutMs(1_000)
 *     .build();
 *
 * Dispatcher dispatcher = new Dispatcher(new PendingRequests(), codec, config);
 * }</pre>
 */
public class RpcConfiguration {

  /**
   * Default for logging excluded methods.
   */
  public static final boolean DEFAULT_REPORT_METHOD_EXCLUSIONS = true;

  /**
   * Default name prefix of dispatch threads.
   */
  public static final String DEFAULT_DISPATCH_THREAD_NAME_PREFIX = "birpc-dispatch";

  /**
   * Default time to wait for in-flight calls when a dispatcher closes (5 seconds).
   */
  public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000;

  private final boolean reportMethodExclusions;
  private final String dispatchThreadNamePrefix;
  private final long shutdownTimeoutMs;

  private RpcConfiguration(Builder builder) {
    this.reportMethodExclusions = builder.reportMethodExclusions;
    this.dispatchThreadNamePrefix = builder.dispatchThreadNamePrefix;
    this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
  }

  /**
   * Whether each method left out of a service's catalog is logged with the reason.
   *
   * @return true if exclusions are logged
   */
  public boolean isReportMethodExclusions() {
    return reportMethodExclusions;
  }

  /**
   * Gets the name prefix of threads created by a dispatcher that owns its executor.
   * Threads are named {@code <prefix>-<n>}.
   *
   * @return The thread name prefix
   */
  public String getDispatchThreadNamePrefix() {
    return dispatchThreadNamePrefix;
  }

  /**
   * Gets how long {@link Dispatcher#close()} waits for in-flight calls before it
   * interrupts them.
   *
   * @return The shutdown timeout in milliseconds
   */
  public long getShutdownTimeoutMs() {
    return shutdownTimeoutMs;
  }

  /**
   * Creates a new builder for RpcConfiguration.
   *
   * @return A new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a default configuration with standard settings.
   *
   * @return A default configuration
   */
  public static RpcConfiguration defaultConfig() {
    return builder().build();
  }

  /**
   * Builder for RpcConfiguration.
   */
  public static class Builder {
    private boolean reportMethodExclusions = DEFAULT_REPORT_METHOD_EXCLUSIONS;
    private String dispatchThreadNamePrefix = DEFAULT_DISPATCH_THREAD_NAME_PREFIX;
    private long shutdownTimeoutMs = DEFAULT_SHUTDOWN_TIMEOUT_MS;

    private Builder() {
    }

    /**
     * Sets whether methods left out of a service's catalog are logged.
     *
     * @param report true to log exclusions
     * @return This builder for chaining
     */
    public Builder reportMethodExclusions(boolean report) {
      this.reportMethodExclusions = report;
      return this;
    }

    /**
     * Sets the name prefix of dispatch threads.
     *
     * @param prefix The prefix (must not be blank)
     * @return This builder for chaining
     * @throws IllegalArgumentException if prefix is null or blank
     */
    public Builder dispatchThreadNamePrefix(String prefix) {
      if (prefix == null || prefix.isBlank()) {
        throw new IllegalArgumentException("Dispatch thread name prefix must not be blank, got: " + prefix);
      }
      this.dispatchThreadNamePrefix = prefix;
      return this;
    }

    /**
     * Sets how long closing a dispatcher waits for in-flight calls.
     * A value of 0 interrupts them right away.
     *
     * @param timeoutMs The timeout in milliseconds (must be non-negative)
     * @return This builder for chaining
     * @throws IllegalArgumentException if timeoutMs is negative
     */
    public Builder shutdownTimeoutMs(long timeoutMs) {
      if (timeoutMs < 0) {
        throw new IllegalArgumentException("Shutdown timeout must be non-negative, got: " + timeoutMs);
      }
      this.shutdownTimeoutMs = timeoutMs;
      return this;
    }

    /**
     * Builds the configuration with the specified settings.
     *
     * @return A new RpcConfiguration instance
     */
    public RpcConfiguration build() {
      return new RpcConfiguration(this);
    }
  }
}
