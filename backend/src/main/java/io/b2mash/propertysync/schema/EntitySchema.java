package io.b2mash.propertysync.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered field declarations for one entity kind. Field order is the order of the canonical record.
 */
public final class EntitySchema {

  private final EntityKind kind;
  private final Map<String, FieldSpec> fields;
  private final List<AliasMapping> aliasTable;

  public EntitySchema(EntityKind kind, List<FieldSpec> fieldSpecs) {
    this.kind = kind;
    var byName = new LinkedHashMap<String, FieldSpec>();
    var aliases = new ArrayList<AliasMapping>();
    for (FieldSpec spec : fieldSpecs) {
      if (byName.putIfAbsent(spec.name(), spec) != null) {
        throw new IllegalArgumentException(
            "Duplicate field " + spec.name() + " in " + kind + " schema");
      }
      for (String inputName : spec.inputNames()) {
        aliases.add(new AliasMapping(inputName, spec.name()));
      }
    }
    this.fields = Collections.unmodifiableMap(byName);
    this.aliasTable = List.copyOf(aliases);
  }

  public EntityKind kind() {
    return kind;
  }

  public List<FieldSpec> fields() {
    return List.copyOf(fields.values());
  }

  public Optional<FieldSpec> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public List<String> requiredFields() {
    return fields.values().stream().filter(FieldSpec::required).map(FieldSpec::name).toList();
  }

  /**
   * Required fields the form itself must provide, i.e. those a transformer neither generates (IDs)
   * nor defaults.
   */
  public List<String> formRequiredFields() {
    return fields.values().stream()
        .filter(FieldSpec::required)
        .filter(spec -> spec.type() != FieldType.ID && spec.defaultValue() == null)
        .map(FieldSpec::name)
        .toList();
  }

  /** The full alias table in evaluation order, flattened across fields. */
  public List<AliasMapping> aliasTable() {
    return aliasTable;
  }

  /**
   * Resolves the raw value for a canonical field: the first alias row targeting the field whose
   * form key holds a present value wins.
   */
  public Object resolve(Map<String, ?> raw, String canonicalField) {
    for (AliasMapping mapping : aliasTable) {
      if (!mapping.canonicalField().equals(canonicalField)) {
        continue;
      }
      Object value = raw.get(mapping.alias());
      if (ValueCoercion.isPresent(value)) {
        return value;
      }
    }
    return null;
  }
}
