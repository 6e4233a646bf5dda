package io.b2mash.propertysync.validation;

/**
 * A single rejected field.
 *
 * @param field canonical field name
 * @param kind category of the failure
 * @param message human-readable description, suitable for display next to the field
 */
public record FieldViolation(String field, ValidationErrorKind kind, String message) {}
