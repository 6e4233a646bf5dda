package io.b2mash.propertysync.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of validating one canonical record. A record is valid only when nothing is missing and
 * no field was rejected; warnings never affect validity.
 *
 * @param valid true iff {@code missingRequired} and {@code violations} are both empty
 * @param violations at most one violation per field, in detection order
 * @param missingRequired required fields that were absent or blank
 * @param warnings non-blocking observations keyed by field
 */
public record ValidationResult(
    boolean valid,
    List<FieldViolation> violations,
    List<String> missingRequired,
    Map<String, String> warnings) {

  public ValidationResult {
    violations = List.copyOf(violations);
    missingRequired = List.copyOf(missingRequired);
    warnings = Collections.unmodifiableMap(new LinkedHashMap<>(warnings));
  }

  /** Field name to message, in detection order. */
  public Map<String, String> errors() {
    var errors = new LinkedHashMap<String, String>();
    for (FieldViolation violation : violations) {
      errors.put(violation.field(), violation.message());
    }
    return errors;
  }

  public Optional<FieldViolation> violation(String field) {
    return violations.stream().filter(v -> v.field().equals(field)).findFirst();
  }
}
