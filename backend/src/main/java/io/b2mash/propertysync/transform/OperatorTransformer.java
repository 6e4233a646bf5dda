package io.b2mash.propertysync.transform;

import io.b2mash.propertysync.ids.IdGenerator;
import io.b2mash.propertysync.schema.CollectionCodec;
import io.b2mash.propertysync.schema.EntitySchemas;
import java.time.Clock;
import org.springframework.stereotype.Component;

/** Operators carry no client-side ID; the backend assigns a numeric one on insert. */
@Component
public class OperatorTransformer extends SchemaDrivenTransformer {

  public OperatorTransformer(
      IdGenerator idGenerator, CollectionCodec collectionCodec, Clock clock) {
    super(EntitySchemas.OPERATOR, idGenerator, collectionCodec, clock);
  }
}
