package io.b2mash.propertysync.validation;

/** Why a field was rejected. */
public enum ValidationErrorKind {
  MISSING_REQUIRED,
  INVALID_ENUM,
  INVALID_FORMAT,
  INVALID_RELATION
}
