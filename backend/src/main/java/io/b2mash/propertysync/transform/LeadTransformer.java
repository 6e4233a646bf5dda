package io.b2mash.propertysync.transform;

import io.b2mash.propertysync.ids.IdGenerator;
import io.b2mash.propertysync.schema.CollectionCodec;
import io.b2mash.propertysync.schema.EntitySchemas;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Leads get a generated {@code LEAD_} ID and {@code EXPLORING} status when the form omits them, so
 * a lead form only has to supply an email address.
 */
@Component
public class LeadTransformer extends SchemaDrivenTransformer {

  public LeadTransformer(IdGenerator idGenerator, CollectionCodec collectionCodec, Clock clock) {
    super(EntitySchemas.LEAD, idGenerator, collectionCodec, clock);
  }
}
