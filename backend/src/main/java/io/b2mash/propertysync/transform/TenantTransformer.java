package io.b2mash.propertysync.transform;

import io.b2mash.propertysync.ids.IdGenerator;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.CollectionCodec;
import io.b2mash.propertysync.schema.EntitySchemas;
import io.b2mash.propertysync.schema.FieldSpec;
import io.b2mash.propertysync.schema.ValueCoercion;
import java.time.Clock;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TenantTransformer extends SchemaDrivenTransformer {

  public TenantTransformer(IdGenerator idGenerator, CollectionCodec collectionCodec, Clock clock) {
    super(EntitySchemas.TENANT, idGenerator, collectionCodec, clock);
  }

  /** Separate first and last name inputs take precedence over a single display name. */
  @Override
  protected Object resolveSource(FieldSpec spec, Map<String, ?> raw) {
    if ("tenant_name".equals(spec.name())) {
      var firstName = raw.get("firstName");
      var lastName = raw.get("lastName");
      if (ValueCoercion.isPresent(firstName) && ValueCoercion.isPresent(lastName)) {
        return firstName.toString().trim() + " " + lastName.toString().trim();
      }
    }
    return super.resolveSource(spec, raw);
  }

  @Override
  public Map<String, Object> toFormState(CanonicalRecord record) {
    var form = super.toFormState(record);
    form.put("email", record.get("tenant_email"));
    form.put("nationality", record.get("tenant_nationality"));
    return form;
  }
}
