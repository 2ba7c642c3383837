package com.gruelbox.transientretry;

import java.time.Duration;

/**
 * Retries an operation first after an initial interval, then doubling the interval after each
 * further failure up to a maximum, up to a maximum number of attempts and/or until a timeout
 * passes.
 *
 * <p>With the defaults (five attempts, one second initially) an operation which always fails is
 * attempted at roughly 0, 1, 3, 7 and 15 seconds before its failure is thrown.
 *
 * <p>Retried transient failures are logged as warnings under {@link #getCategoryName()} unless a
 * {@link TransientListener} handles them. The final failure is never logged here.
 */
public final class ExponentialRetryPolicy extends AbstractRetryPolicy {

  private final ExponentialBackoff backoff;

  private ExponentialRetryPolicy(ExponentialRetryPolicyBuilder builder) {
    super(builder);
    this.backoff =
        ExponentialBackoff.exponential(
            builder.initialRetryInterval == null
                ? Duration.ofSeconds(1)
                : builder.initialRetryInterval,
            builder.maxRetryInterval == null ? Duration.ofHours(24) : builder.maxRetryInterval);
  }

  private ExponentialRetryPolicy(
      ExponentialRetryPolicy other, TransientDetector transientDetector) {
    super(other, transientDetector);
    this.backoff = other.backoff;
  }

  public static ExponentialRetryPolicyBuilder builder() {
    return new ExponentialRetryPolicyBuilder();
  }

  /**
   * @return The interval after the first failure. Never more than {@link #getMaxRetryInterval()}.
   */
  public Duration getInitialRetryInterval() {
    return backoff.getInitialInterval();
  }

  /**
   * @return The longest interval between attempts.
   */
  public Duration getMaxRetryInterval() {
    return backoff.getMaxInterval();
  }

  @Override
  public ExponentialBackoff getBackoff() {
    return backoff;
  }

  @Override
  public ExponentialRetryPolicy withTransientDetector(TransientDetector transientDetector) {
    if (transientDetector == null) {
      return this;
    }
    return new ExponentialRetryPolicy(this, transientDetector);
  }

  @Override
  public String toString() {
    return "ExponentialRetryPolicy(maxAttempts="
        + getMaxAttempts()
        + ", initialRetryInterval="
        + getInitialRetryInterval()
        + ", maxRetryInterval="
        + getMaxRetryInterval()
        + ", timeout="
        + getTimeout()
        + ")";
  }

  /** Builder for {@link ExponentialRetryPolicy}. */
  public static final class ExponentialRetryPolicyBuilder
      extends AbstractRetryPolicyBuilder<ExponentialRetryPolicyBuilder, ExponentialRetryPolicy> {

    private Duration initialRetryInterval;
    private Duration maxRetryInterval;

    ExponentialRetryPolicyBuilder() {}

    /**
     * @param initialRetryInterval The interval after the first failure. Defaults to one second.
     *     Must be positive. If greater than the maximum, the maximum is used instead.
     * @return Builder.
     */
    public ExponentialRetryPolicyBuilder initialRetryInterval(Duration initialRetryInterval) {
      this.initialRetryInterval = initialRetryInterval;
      return this;
    }

    /**
     * @param maxRetryInterval The longest interval between attempts. Defaults to 24 hours. May not
     *     be negative. Zero means no attempt is ever retried.
     * @return Builder.
     */
    public ExponentialRetryPolicyBuilder maxRetryInterval(Duration maxRetryInterval) {
      this.maxRetryInterval = maxRetryInterval;
      return this;
    }

    @Override
    protected ExponentialRetryPolicyBuilder self() {
      return this;
    }

    @Override
    protected ExponentialRetryPolicy newPolicy() {
      return new ExponentialRetryPolicy(this);
    }

    @Override
    public void validate(Validator validator) {
      super.validate(validator);
      if (initialRetryInterval != null) {
        validator.positive("initialRetryInterval", initialRetryInterval);
      }
      if (maxRetryInterval != null) {
        validator.positiveOrZero("maxRetryInterval", maxRetryInterval);
      }
    }
  }
}
