package io.b2mash.propertysync.validation;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntitySchemas;
import org.springframework.stereotype.Component;

@Component
public class LeadValidator extends SchemaDrivenValidator {

  public LeadValidator(EnumCatalog enumCatalog) {
    super(EntitySchemas.LEAD, enumCatalog);
  }

  @Override
  protected void checkRelations(CanonicalRecord record, ValidationErrors errors) {
    // equal budgets are a fixed budget, not an inverted range
    var budgetMin = numberValue(record, "budget_min");
    var budgetMax = numberValue(record, "budget_max");
    if (!errors.hasError("budget_min")
        && budgetMin.isPresent()
        && budgetMax.isPresent()
        && budgetMin.get().compareTo(budgetMax.get()) > 0) {
      errors.reject(
          "budget_max",
          ValidationErrorKind.INVALID_RELATION,
          "Maximum budget must be greater than minimum budget");
    }

    if (errors.hasError("planned_move_in") || errors.hasError("planned_move_out")) {
      return;
    }
    var moveIn = dateValue(record, "planned_move_in");
    var moveOut = dateValue(record, "planned_move_out");
    if (moveIn.isPresent() && moveOut.isPresent() && !moveOut.get().isAfter(moveIn.get())) {
      errors.reject(
          "planned_move_out",
          ValidationErrorKind.INVALID_RELATION,
          "Planned move-out must be after planned move-in");
    }
  }
}
