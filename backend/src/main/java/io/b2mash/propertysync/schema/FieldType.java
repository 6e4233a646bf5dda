package io.b2mash.propertysync.schema;

/** Canonical value types a record field can carry after transformation. */
public enum FieldType {
  TEXT,
  EMAIL,
  PHONE,
  URL,
  ENUM,
  INTEGER,
  DECIMAL,
  BOOLEAN,
  DATE,
  TIMESTAMP,
  COLLECTION,
  STRUCTURED,
  ID
}
