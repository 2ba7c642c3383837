package com.gruelbox.transientretry;

/** Implemented by configuration objects which check their own state on build. */
public interface Validatable {

  void validate(Validator validator);
}
