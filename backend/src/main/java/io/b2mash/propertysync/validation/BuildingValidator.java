package io.b2mash.propertysync.validation;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntitySchemas;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Year;
import org.springframework.stereotype.Component;

@Component
public class BuildingValidator extends SchemaDrivenValidator {

  static final int EARLIEST_YEAR_BUILT = 1800;
  static final int FUTURE_YEAR_ALLOWANCE = 5;

  private final Clock clock;

  public BuildingValidator(EnumCatalog enumCatalog, Clock clock) {
    super(EntitySchemas.BUILDING, enumCatalog);
    this.clock = clock;
  }

  @Override
  protected void checkRelations(CanonicalRecord record, ValidationErrors errors) {
    long latestYear = Year.now(clock).getValue() + FUTURE_YEAR_ALLOWANCE;

    var yearBuilt = numberValue(record, "year_built");
    if (!errors.hasError("year_built")
        && yearBuilt
            .filter(
                year ->
                    year.compareTo(BigDecimal.valueOf(EARLIEST_YEAR_BUILT)) < 0
                        || year.compareTo(BigDecimal.valueOf(latestYear)) > 0)
            .isPresent()) {
      errors.reject(
          "year_built", ValidationErrorKind.INVALID_RELATION, "Please enter a valid year");
    }

    var lastRenovation = numberValue(record, "last_renovation");
    if (!errors.hasError("last_renovation") && lastRenovation.isPresent()) {
      var renovated = lastRenovation.get();
      if (renovated.compareTo(BigDecimal.valueOf(latestYear)) > 0) {
        errors.reject(
            "last_renovation", ValidationErrorKind.INVALID_RELATION, "Please enter a valid year");
      } else if (!errors.hasError("year_built")
          && yearBuilt.filter(built -> renovated.compareTo(built) < 0).isPresent()) {
        errors.reject(
            "last_renovation",
            ValidationErrorKind.INVALID_RELATION,
            "Last renovation cannot be before year built");
      }
    }

    var minLease = numberValue(record, "min_lease_term");
    var preferredMinLease = numberValue(record, "pref_min_lease_term");
    if (!errors.hasError("min_lease_term")
        && !errors.hasError("pref_min_lease_term")
        && minLease.isPresent()
        && preferredMinLease.isPresent()
        && preferredMinLease.get().compareTo(minLease.get()) < 0) {
      errors.reject(
          "pref_min_lease_term",
          ValidationErrorKind.INVALID_RELATION,
          "Preferred minimum lease term cannot be less than minimum lease term");
    }
  }

  @Override
  protected void collectWarnings(CanonicalRecord record, ValidationErrors errors) {
    var perFloor = numberValue(record, "bathrooms_on_each_floor");
    var floors = numberValue(record, "floors");
    var total = numberValue(record, "total_bathrooms");
    if (perFloor.isPresent() && floors.isPresent() && total.isPresent()) {
      if (perFloor.get().multiply(floors.get()).compareTo(total.get()) > 0) {
        errors.warn(
            "bathrooms_on_each_floor",
            "Bathrooms per floor seems high compared to total bathrooms");
      }
    }
  }
}
