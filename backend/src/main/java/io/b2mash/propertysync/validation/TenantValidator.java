package io.b2mash.propertysync.validation;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntitySchemas;
import io.b2mash.propertysync.schema.FieldSpec;
import org.springframework.stereotype.Component;

/**
 * Tenant rules. The lease must end strictly after it starts; the violation is reported on {@code
 * lease_end_date}. Nationality is free text and is not checked against a vocabulary.
 */
@Component
public class TenantValidator extends SchemaDrivenValidator {

  public TenantValidator(EnumCatalog enumCatalog) {
    super(EntitySchemas.TENANT, enumCatalog);
  }

  @Override
  protected String invalidEmailMessage(FieldSpec spec) {
    return "Please enter a valid email address";
  }

  @Override
  protected void checkRelations(CanonicalRecord record, ValidationErrors errors) {
    if (errors.hasError("lease_start_date") || errors.hasError("lease_end_date")) {
      return;
    }
    var start = dateValue(record, "lease_start_date");
    var end = dateValue(record, "lease_end_date");
    if (start.isPresent() && end.isPresent() && !end.get().isAfter(start.get())) {
      errors.reject(
          "lease_end_date",
          ValidationErrorKind.INVALID_RELATION,
          "Lease end date must be after start date");
    }
  }
}
