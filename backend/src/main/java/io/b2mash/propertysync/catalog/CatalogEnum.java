package io.b2mash.propertysync.catalog;

/**
 * Named closed vocabularies shared across entity kinds. The constant name is the key under which
 * the vocabulary is declared in {@code enum-catalog.json}.
 */
public enum CatalogEnum {
  OPERATOR_TYPES("operator type"),
  OPERATOR_ROLES("role selection"),
  NOTIFICATION_PREFERENCES("notification preference"),
  ROOM_STATUS("room status"),
  BATHROOM_TYPES("bathroom type"),
  BED_SIZES("bed size"),
  BED_TYPES("bed type"),
  ROOM_VIEWS("room view"),
  ROOM_STORAGE("room storage option"),
  NOISE_LEVELS("noise level"),
  SUNLIGHT_LEVELS("sunlight level"),
  PET_FRIENDLY_OPTIONS("pet policy selection"),
  COMMON_KITCHEN_OPTIONS("common kitchen option"),
  CLEANING_SCHEDULES("cleaning schedule"),
  TENANT_STATUS("tenant status"),
  BOOKING_TYPES("booking type"),
  TENANT_NATIONALITY("nationality"),
  PAYMENT_STATUS("payment status"),
  COMMUNICATION_PREFERENCES("communication preference"),
  ACCOUNT_STATUS("account status"),
  EMERGENCY_CONTACT_RELATIONS("emergency contact relation"),
  LEAD_STATUS("lead status"),
  VISA_STATUS("visa status"),
  LEAD_SOURCES("lead source"),
  PREFERRED_COMMUNICATION("communication preference");

  private final String displayLabel;

  CatalogEnum(String displayLabel) {
    this.displayLabel = displayLabel;
  }

  /** Lower-case noun used in "Invalid ..." messages. */
  public String getDisplayLabel() {
    return displayLabel;
  }

  /**
   * Resolves an enumeration by its catalog key.
   *
   * @throws IllegalArgumentException if no enumeration has that key
   */
  public static CatalogEnum fromKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Enumeration name must not be blank");
    }
    for (CatalogEnum candidate : values()) {
      if (candidate.name().equals(key)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown enumeration: " + key);
  }
}
