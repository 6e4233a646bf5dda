package io.b2mash.propertysync.schema;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/** Supplies a business default for a field the form left empty. */
@FunctionalInterface
public interface FieldDefault {

  Object supply(Clock clock);

  static FieldDefault constant(Object value) {
    return clock -> value;
  }

  /** Today's date as {@code YYYY-MM-DD} in the clock's zone. */
  static FieldDefault today() {
    return clock -> LocalDate.now(clock).toString();
  }

  /** The current instant in ISO-8601 form. */
  static FieldDefault now() {
    return clock -> Instant.now(clock).toString();
  }
}
