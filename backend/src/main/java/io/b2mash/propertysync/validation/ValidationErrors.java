package io.b2mash.propertysync.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects violations during one validation pass. The first violation recorded for a field wins;
 * later scans cannot overwrite it.
 */
public final class ValidationErrors {

  private final Map<String, FieldViolation> violations = new LinkedHashMap<>();
  private final List<String> missingRequired = new ArrayList<>();
  private final Map<String, String> warnings = new LinkedHashMap<>();

  public void missing(String field, String message) {
    if (violations.containsKey(field)) {
      return;
    }
    missingRequired.add(field);
    violations.put(field, new FieldViolation(field, ValidationErrorKind.MISSING_REQUIRED, message));
  }

  public void reject(String field, ValidationErrorKind kind, String message) {
    violations.putIfAbsent(field, new FieldViolation(field, kind, message));
  }

  public void warn(String field, String message) {
    warnings.putIfAbsent(field, message);
  }

  public boolean hasError(String field) {
    return violations.containsKey(field);
  }

  public ValidationResult toResult() {
    boolean valid = missingRequired.isEmpty() && violations.isEmpty();
    return new ValidationResult(
        valid, new ArrayList<>(violations.values()), missingRequired, warnings);
  }
}
