package io.b2mash.propertysync.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Backend-shaped record produced by a transformer. Immutable; null values are kept so that every
 * schema field is present as a key.
 */
public final class CanonicalRecord {

  private final EntityKind kind;
  private final Map<String, Object> values;

  public CanonicalRecord(EntityKind kind, Map<String, ?> values) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public EntityKind kind() {
    return kind;
  }

  public Object get(String field) {
    return values.get(field);
  }

  public String getString(String field) {
    Object value = values.get(field);
    return value == null ? null : value.toString();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalRecord other)) {
      return false;
    }
    return kind == other.kind && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, values);
  }

  @Override
  public String toString() {
    return kind + values.toString();
  }
}
