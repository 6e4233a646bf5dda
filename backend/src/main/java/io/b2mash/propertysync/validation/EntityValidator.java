package io.b2mash.propertysync.validation;

import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntityKind;

/**
 * Checks a transformed record against the backend's rules for one entity kind. Problems are
 * returned as data; validators never throw for bad field values.
 */
public interface EntityValidator {

  EntityKind supports();

  ValidationResult validate(CanonicalRecord record);
}
