package io.b2mash.propertysync.validation;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntityKind;
import io.b2mash.propertysync.schema.EntitySchema;
import io.b2mash.propertysync.schema.FieldSpec;
import io.b2mash.propertysync.schema.FieldType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Runs the four validation scans in a fixed order over an {@link EntitySchema}:
 *
 * <ol>
 *   <li>required fields (null, blank text or NaN; booleans are never missing)
 *   <li>enumerated fields against the {@link EnumCatalog}
 *   <li>formats: email, phone, URL, strict ISO dates, unparsed numbers
 *   <li>relations: declared numeric bounds, then {@link #checkRelations} for the entity's
 *       cross-field rules
 * </ol>
 *
 * <p>Once a field has an error, later scans skip it.
 */
public abstract class SchemaDrivenValidator implements EntityValidator {

  private final EntitySchema schema;
  private final EnumCatalog enumCatalog;

  protected SchemaDrivenValidator(EntitySchema schema, EnumCatalog enumCatalog) {
    this.schema = schema;
    this.enumCatalog = enumCatalog;
  }

  @Override
  public EntityKind supports() {
    return schema.kind();
  }

  @Override
  public ValidationResult validate(CanonicalRecord record) {
    if (record.kind() != schema.kind()) {
      throw new IllegalArgumentException(
          "Expected a " + schema.kind() + " record but got " + record.kind());
    }
    var errors = new ValidationErrors();
    checkRequired(record, errors);
    checkEnums(record, errors);
    checkFormats(record, errors);
    checkBounds(record, errors);
    checkRelations(record, errors);
    collectWarnings(record, errors);
    return errors.toResult();
  }

  /** Entity-specific cross-field rules. Runs after every per-field scan. */
  protected void checkRelations(CanonicalRecord record, ValidationErrors errors) {}

  /** Non-blocking observations; they never make a record invalid. */
  protected void collectWarnings(CanonicalRecord record, ValidationErrors errors) {}

  protected String invalidEmailMessage(FieldSpec spec) {
    return "Invalid email format";
  }

  /** The field as a calendar date, if it holds a well-formed one. */
  protected static Optional<LocalDate> dateValue(CanonicalRecord record, String field) {
    return FieldFormats.parseDate(record.getString(field));
  }

  /** The field as a number, if the transformer was able to parse it. */
  protected static Optional<BigDecimal> numberValue(CanonicalRecord record, String field) {
    Object value = record.get(field);
    if (value instanceof BigDecimal number) {
      return Optional.of(number);
    }
    if (value instanceof Long number) {
      return Optional.of(BigDecimal.valueOf(number));
    }
    if (value instanceof Integer number) {
      return Optional.of(BigDecimal.valueOf(number));
    }
    return Optional.empty();
  }

  protected static boolean isTrue(CanonicalRecord record, String field) {
    return Boolean.TRUE.equals(record.get(field));
  }

  private void checkRequired(CanonicalRecord record, ValidationErrors errors) {
    for (String field : schema.requiredFields()) {
      if (isMissing(record.get(field))) {
        errors.missing(field, label(field) + " is required");
      }
    }
  }

  private void checkEnums(CanonicalRecord record, ValidationErrors errors) {
    for (FieldSpec spec : schema.fields()) {
      if (spec.enumeration() == null || errors.hasError(spec.name())) {
        continue;
      }
      Object value = record.get(spec.name());
      if (value != null && !enumCatalog.isMember(spec.enumeration(), value.toString())) {
        errors.reject(
            spec.name(),
            ValidationErrorKind.INVALID_ENUM,
            "Invalid " + spec.enumeration().getDisplayLabel());
      }
    }
  }

  private void checkFormats(CanonicalRecord record, ValidationErrors errors) {
    for (FieldSpec spec : schema.fields()) {
      Object value = record.get(spec.name());
      if (value == null || errors.hasError(spec.name())) {
        continue;
      }
      String message = formatError(spec, value);
      if (message != null) {
        errors.reject(spec.name(), ValidationErrorKind.INVALID_FORMAT, message);
      }
    }
  }

  private String formatError(FieldSpec spec, Object value) {
    String text = value.toString();
    return switch (spec.type()) {
      case EMAIL -> FieldFormats.isValidEmail(text) ? null : invalidEmailMessage(spec);
      case PHONE -> FieldFormats.isValidPhone(text) ? null : "Please enter a valid phone number";
      case URL -> FieldFormats.isValidUrl(text) ? null : "URL must start with http:// or https://";
      case DATE -> FieldFormats.isValidDate(text) ? null : "Invalid date format (use YYYY-MM-DD)";
      case INTEGER, DECIMAL ->
          value instanceof Number ? null : spec.label() + " must be a valid number";
      default -> null;
    };
  }

  private void checkBounds(CanonicalRecord record, ValidationErrors errors) {
    for (FieldSpec spec : schema.fields()) {
      if (errors.hasError(spec.name())) {
        continue;
      }
      if (spec.type() == FieldType.INTEGER && record.get(spec.name()) instanceof BigDecimal) {
        // integer part too large for a long
        errors.reject(
            spec.name(),
            ValidationErrorKind.INVALID_RELATION,
            spec.rangeMessage() != null ? spec.rangeMessage() : spec.label() + " is out of range");
        continue;
      }
      if (!spec.hasBounds()) {
        continue;
      }
      numberValue(record, spec.name())
          .filter(number -> !withinBounds(spec, number))
          .ifPresent(
              number ->
                  errors.reject(
                      spec.name(), ValidationErrorKind.INVALID_RELATION, spec.rangeMessage()));
    }
  }

  private static boolean withinBounds(FieldSpec spec, BigDecimal number) {
    if (spec.min() != null && number.compareTo(spec.min()) < 0) {
      return false;
    }
    return spec.max() == null || number.compareTo(spec.max()) <= 0;
  }

  private static boolean isMissing(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof String str) {
      return str.isBlank();
    }
    if (value instanceof Double d) {
      return d.isNaN();
    }
    if (value instanceof Float f) {
      return f.isNaN();
    }
    return false;
  }

  private String label(String field) {
    return schema.field(field).map(FieldSpec::label).orElse(field);
  }
}
