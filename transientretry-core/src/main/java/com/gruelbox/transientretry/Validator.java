package com.gruelbox.transientretry;

import java.time.Duration;

/**
 * Checks configuration as it is built, failing fast with an {@link IllegalArgumentException} naming
 * the offending property.
 */
public final class Validator {

  private final String path;

  Validator() {
    this.path = "";
  }

  private Validator(String className, Validator validator) {
    this.path = validator.path.isEmpty() ? className : validator.path + "." + className;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName(), this));
  }

  public void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  public void min(String propertyName, int object, int minimumValue) {
    if (object < minimumValue) {
      error(propertyName, "must be at least " + minimumValue);
    }
  }

  public void positiveOrZero(String propertyName, Duration duration) {
    notNull(propertyName, duration);
    if (duration.isNegative()) {
      error(propertyName, "may not be negative");
    }
  }

  public void positive(String propertyName, Duration duration) {
    notNull(propertyName, duration);
    if (duration.isNegative() || duration.isZero()) {
      error(propertyName, "must be greater than zero");
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
