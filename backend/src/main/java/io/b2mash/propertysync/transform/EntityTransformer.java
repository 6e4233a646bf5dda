package io.b2mash.propertysync.transform;

import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntityKind;
import io.b2mash.propertysync.schema.EntitySchema;
import java.util.Map;

/**
 * Maps loosely shaped form state onto one entity kind's canonical record. Implementations never
 * fail on bad input: values that cannot be coerced are carried through for the validator to
 * reject.
 */
public interface EntityTransformer {

  EntityKind supports();

  EntitySchema schema();

  CanonicalRecord transform(Map<String, ?> rawInput);

  /** Reverse mapping: canonical record back to the shape the forms bind to. */
  Map<String, Object> toFormState(CanonicalRecord record);
}
