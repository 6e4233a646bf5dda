package io.b2mash.propertysync.schema;

import io.b2mash.propertysync.catalog.CatalogEnum;
import io.b2mash.propertysync.ids.IdPrefix;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Declaration of one canonical field: its type, the form keys it may arrive under, and the rules
 * the validator applies to it.
 *
 * @param name canonical (backend) field name
 * @param label human-readable name used in messages
 * @param type canonical value type
 * @param inputNames form keys that feed this field, in priority order
 * @param required whether the backend rejects the record without it
 * @param enumeration closed vocabulary for {@link FieldType#ENUM} fields, else null
 * @param defaultValue supplied when no input name carries a value, or null for no default
 * @param min inclusive lower bound for numeric fields, or null
 * @param max inclusive upper bound for numeric fields, or null
 * @param rangeMessage message reported when a bound is violated
 * @param lowercase whether text input is lower-cased after trimming
 * @param idPrefix prefix for generated IDs on {@link FieldType#ID} fields
 */
public record FieldSpec(
    String name,
    String label,
    FieldType type,
    List<String> inputNames,
    boolean required,
    CatalogEnum enumeration,
    FieldDefault defaultValue,
    BigDecimal min,
    BigDecimal max,
    String rangeMessage,
    boolean lowercase,
    IdPrefix idPrefix) {

  public FieldSpec {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Field name must not be blank");
    }
    var names = new ArrayList<String>(inputNames == null ? List.of() : inputNames);
    if (!names.contains(name)) {
      names.add(name);
    }
    inputNames = List.copyOf(names);
    if (label == null) {
      label = name;
    }
  }

  public static FieldSpec of(String name, String label, FieldType type) {
    return new FieldSpec(
        name, label, type, List.of(), false, null, null, null, null, null, false, null);
  }

  public static FieldSpec text(String name, String label) {
    return of(name, label, FieldType.TEXT);
  }

  public static FieldSpec enumerated(String name, String label, CatalogEnum enumeration) {
    return of(name, label, FieldType.ENUM).withEnumeration(enumeration);
  }

  public static FieldSpec id(String name, String label, IdPrefix prefix) {
    return new FieldSpec(
        name, label, FieldType.ID, List.of(), false, null, null, null, null, null, false, prefix);
  }

  /** Form keys checked before the canonical name; the canonical name is always checked last. */
  public FieldSpec from(String... names) {
    return new FieldSpec(
        name, label, type, List.of(names), required, enumeration, defaultValue, min, max,
        rangeMessage, lowercase, idPrefix);
  }

  public FieldSpec mandatory() {
    return new FieldSpec(
        name, label, type, inputNames, true, enumeration, defaultValue, min, max, rangeMessage,
        lowercase, idPrefix);
  }

  public FieldSpec withEnumeration(CatalogEnum value) {
    return new FieldSpec(
        name, label, type, inputNames, required, value, defaultValue, min, max, rangeMessage,
        lowercase, idPrefix);
  }

  public FieldSpec defaultsTo(Object value) {
    return defaultsTo(FieldDefault.constant(value));
  }

  public FieldSpec defaultsTo(FieldDefault value) {
    return new FieldSpec(
        name, label, type, inputNames, required, enumeration, value, min, max, rangeMessage,
        lowercase, idPrefix);
  }

  public FieldSpec atLeast(long lower, String message) {
    return between(BigDecimal.valueOf(lower), null, message);
  }

  public FieldSpec between(long lower, long upper, String message) {
    return between(BigDecimal.valueOf(lower), BigDecimal.valueOf(upper), message);
  }

  private FieldSpec between(BigDecimal lower, BigDecimal upper, String message) {
    return new FieldSpec(
        name, label, type, inputNames, required, enumeration, defaultValue, lower, upper, message,
        lowercase, idPrefix);
  }

  public FieldSpec lowercased() {
    return new FieldSpec(
        name, label, type, inputNames, required, enumeration, defaultValue, min, max, rangeMessage,
        true, idPrefix);
  }

  public boolean hasBounds() {
    return min != null || max != null;
  }
}
