package io.b2mash.propertysync.validation;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntitySchemas;
import org.springframework.stereotype.Component;

@Component
public class OperatorValidator extends SchemaDrivenValidator {

  public OperatorValidator(EnumCatalog enumCatalog) {
    super(EntitySchemas.OPERATOR, enumCatalog);
  }

  @Override
  protected void collectWarnings(CanonicalRecord record, ValidationErrors errors) {
    if (record.get("calendar_external_id") != null && !isTrue(record, "calendar_sync_enabled")) {
      errors.warn(
          "calendar_external_id", "Calendar external ID provided but sync is not enabled");
    }
  }
}
