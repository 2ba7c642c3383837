package com.gruelbox.transientretry;

import java.time.Duration;

/**
 * Retries an operation at a fixed interval, up to a maximum number of attempts and/or until a
 * timeout passes.
 *
 * <p>Retried transient failures are logged as warnings under {@link #getCategoryName()} unless a
 * {@link TransientListener} handles them. The final failure is never logged here; it's assumed the
 * caller will handle it.
 */
public final class LinearRetryPolicy extends AbstractRetryPolicy {

  private final Duration retryInterval;
  private final FixedBackoff backoff;

  private LinearRetryPolicy(LinearRetryPolicyBuilder builder) {
    super(builder);
    this.retryInterval =
        builder.retryInterval == null ? Duration.ofSeconds(1) : builder.retryInterval;
    this.backoff = FixedBackoff.withInterval(retryInterval);
  }

  private LinearRetryPolicy(LinearRetryPolicy other, TransientDetector transientDetector) {
    super(other, transientDetector);
    this.retryInterval = other.retryInterval;
    this.backoff = other.backoff;
  }

  public static LinearRetryPolicyBuilder builder() {
    return new LinearRetryPolicyBuilder();
  }

  /**
   * @return The interval between attempts.
   */
  public Duration getRetryInterval() {
    return retryInterval;
  }

  @Override
  public FixedBackoff getBackoff() {
    return backoff;
  }

  @Override
  public LinearRetryPolicy withTransientDetector(TransientDetector transientDetector) {
    if (transientDetector == null) {
      return this;
    }
    return new LinearRetryPolicy(this, transientDetector);
  }

  @Override
  public void validate(Validator validator) {
    super.validate(validator);
    validator.positiveOrZero("retryInterval", retryInterval);
  }

  @Override
  public String toString() {
    return "LinearRetryPolicy(maxAttempts="
        + getMaxAttempts()
        + ", retryInterval="
        + retryInterval
        + ", timeout="
        + getTimeout()
        + ")";
  }

  /** Builder for {@link LinearRetryPolicy}. */
  public static final class LinearRetryPolicyBuilder
      extends AbstractRetryPolicyBuilder<LinearRetryPolicyBuilder, LinearRetryPolicy> {

    private Duration retryInterval;

    LinearRetryPolicyBuilder() {}

    /**
     * @param retryInterval The interval between attempts. Defaults to one second. May not be
     *     negative. Zero means no attempt is ever retried, since a retry would have no time to
     *     wait.
     * @return Builder.
     */
    public LinearRetryPolicyBuilder retryInterval(Duration retryInterval) {
      this.retryInterval = retryInterval;
      return this;
    }

    @Override
    protected LinearRetryPolicyBuilder self() {
      return this;
    }

    @Override
    protected LinearRetryPolicy newPolicy() {
      return new LinearRetryPolicy(this);
    }

    @Override
    public void validate(Validator validator) {
      super.validate(validator);
      if (retryInterval != null) {
        validator.positiveOrZero("retryInterval", retryInterval);
      }
    }
  }
}
