package io.b2mash.propertysync.transform;

import io.b2mash.propertysync.ids.IdGenerator;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.CollectionCodec;
import io.b2mash.propertysync.schema.EntityKind;
import io.b2mash.propertysync.schema.EntitySchema;
import io.b2mash.propertysync.schema.FieldSpec;
import io.b2mash.propertysync.schema.FieldType;
import io.b2mash.propertysync.schema.ValueCoercion;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base transformer that walks an {@link EntitySchema}: each field's value is taken from the first
 * alias holding a value, coerced to the field type, and defaulted when still absent. Subclasses
 * override {@link #resolveSource} for fields derived from several inputs.
 */
public abstract class SchemaDrivenTransformer implements EntityTransformer {

  private final EntitySchema schema;
  private final IdGenerator idGenerator;
  private final CollectionCodec collectionCodec;
  private final Clock clock;

  protected SchemaDrivenTransformer(
      EntitySchema schema, IdGenerator idGenerator, CollectionCodec collectionCodec, Clock clock) {
    this.schema = schema;
    this.idGenerator = idGenerator;
    this.collectionCodec = collectionCodec;
    this.clock = clock;
  }

  @Override
  public EntityKind supports() {
    return schema.kind();
  }

  @Override
  public EntitySchema schema() {
    return schema;
  }

  @Override
  public CanonicalRecord transform(Map<String, ?> rawInput) {
    Map<String, ?> raw = rawInput == null ? Map.of() : rawInput;
    var values = new LinkedHashMap<String, Object>();
    for (FieldSpec spec : schema.fields()) {
      values.put(spec.name(), coerce(spec, resolveSource(spec, raw)));
    }
    return new CanonicalRecord(schema.kind(), values);
  }

  @Override
  public Map<String, Object> toFormState(CanonicalRecord record) {
    if (record.kind() != schema.kind()) {
      throw new IllegalArgumentException(
          "Expected a " + schema.kind() + " record but got " + record.kind());
    }
    var form = new LinkedHashMap<String, Object>(record.asMap());
    for (FieldSpec spec : schema.fields()) {
      if (spec.type() == FieldType.COLLECTION) {
        form.put(spec.name(), collectionCodec.decode(record.get(spec.name())));
      }
    }
    return form;
  }

  /** Raw value feeding {@code spec}; by default the first alias in the schema's alias table. */
  protected Object resolveSource(FieldSpec spec, Map<String, ?> raw) {
    return schema.resolve(raw, spec.name());
  }

  private Object coerce(FieldSpec spec, Object source) {
    Object value =
        switch (spec.type()) {
          case ID -> idGenerator.assignIfAbsent(source, spec.idPrefix());
          case TEXT, EMAIL, PHONE, URL -> ValueCoercion.toText(source, spec.lowercase());
          case ENUM -> ValueCoercion.isPresent(source) ? source.toString() : null;
          case INTEGER -> ValueCoercion.toInteger(source);
          case DECIMAL -> ValueCoercion.toDecimal(source);
          case BOOLEAN -> ValueCoercion.toBoolean(source, defaultFlag(spec));
          case COLLECTION -> collectionCodec.encode(source);
          case DATE, TIMESTAMP, STRUCTURED -> ValueCoercion.isPresent(source) ? source : null;
        };
    if (value == null && spec.defaultValue() != null) {
      return spec.defaultValue().supply(clock);
    }
    return value;
  }

  private boolean defaultFlag(FieldSpec spec) {
    return spec.defaultValue() != null
        && Boolean.TRUE.equals(spec.defaultValue().supply(clock));
  }
}
