package io.b2mash.propertysync.sync;

import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.validation.ValidationResult;

/** A transformed record together with its validation outcome. */
public record SyncResult(CanonicalRecord record, ValidationResult validation) {

  public boolean isValid() {
    return validation.valid();
  }
}
