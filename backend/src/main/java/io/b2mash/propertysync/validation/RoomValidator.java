package io.b2mash.propertysync.validation;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntitySchemas;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

@Component
public class RoomValidator extends SchemaDrivenValidator {

  public RoomValidator(EnumCatalog enumCatalog) {
    super(EntitySchemas.ROOM, enumCatalog);
  }

  @Override
  protected void checkRelations(CanonicalRecord record, ValidationErrors errors) {
    if (errors.hasError("booked_from") || errors.hasError("booked_till")) {
      return;
    }
    var bookedFrom = dateValue(record, "booked_from");
    var bookedTill = dateValue(record, "booked_till");
    if (bookedFrom.isPresent()
        && bookedTill.isPresent()
        && !bookedTill.get().isAfter(bookedFrom.get())) {
      errors.reject(
          "booked_till",
          ValidationErrorKind.INVALID_RELATION,
          "Booked till date must be after booked from date");
    }
  }

  @Override
  protected void collectWarnings(CanonicalRecord record, ValidationErrors errors) {
    var status = record.getString("status");
    boolean hasTenants =
        numberValue(record, "active_tenants")
            .filter(count -> count.compareTo(BigDecimal.ZERO) > 0)
            .isPresent();
    if ("OCCUPIED".equals(status) && !hasTenants) {
      errors.warn("active_tenants", "Room is marked as occupied but has no active tenants");
    }
    if ("AVAILABLE".equals(status) && hasTenants) {
      errors.warn("status", "Room is marked as available but has active tenants");
    }
    if ("AVAILABLE".equals(status) && Boolean.FALSE.equals(record.get("ready_to_rent"))) {
      errors.warn("ready_to_rent", "Room is marked as available but not ready to rent");
    }
  }
}
