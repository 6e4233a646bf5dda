package io.b2mash.propertysync.schema;

import static io.b2mash.propertysync.schema.FieldSpec.enumerated;
import static io.b2mash.propertysync.schema.FieldSpec.id;
import static io.b2mash.propertysync.schema.FieldSpec.of;
import static io.b2mash.propertysync.schema.FieldSpec.text;

import io.b2mash.propertysync.catalog.CatalogEnum;
import io.b2mash.propertysync.ids.IdPrefix;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical field declarations for every entity kind, mirroring the backend's column set. Field
 * order here is the order of the transformed record; within a field, {@link FieldSpec#from} lists
 * the form keys in the order they are tried.
 */
public final class EntitySchemas {

  public static final EntitySchema OPERATOR =
      new EntitySchema(
          EntityKind.OPERATOR,
          List.of(
              text("name", "Name").mandatory(),
              of("email", "Email", FieldType.EMAIL).mandatory().lowercased(),
              of("phone", "Phone number", FieldType.PHONE),
              enumerated("role", "Role", CatalogEnum.OPERATOR_ROLES),
              bool("active", true),
              of("date_joined", "Date joined", FieldType.DATE).defaultsTo(FieldDefault.today()),
              of("last_active", "Last active", FieldType.TIMESTAMP),
              enumerated("operator_type", "Operator type", CatalogEnum.OPERATOR_TYPES)
                  .defaultsTo("LEASING_AGENT"),
              of("permissions", "Permissions", FieldType.STRUCTURED),
              enumerated(
                      "notification_preferences",
                      "Notification preference",
                      CatalogEnum.NOTIFICATION_PREFERENCES)
                  .defaultsTo("EMAIL"),
              of("working_hours", "Working hours", FieldType.STRUCTURED),
              bool("emergency_contact", false),
              bool("calendar_sync_enabled", false),
              text("calendar_external_id", "Calendar external ID")));

  public static final EntitySchema BUILDING =
      new EntitySchema(EntityKind.BUILDING, buildingFields());

  public static final EntitySchema ROOM = new EntitySchema(EntityKind.ROOM, roomFields());

  public static final EntitySchema TENANT =
      new EntitySchema(
          EntityKind.TENANT,
          List.of(
              id("tenant_id", "Tenant ID", IdPrefix.TENANT).mandatory(),
              text("tenant_name", "Full name").mandatory(),
              of("tenant_email", "Email address", FieldType.EMAIL).from("email").mandatory(),
              text("tenant_nationality", "Nationality").from("nationality"),
              text("room_id", "Room selection").from("selected_room_id").mandatory(),
              text("building_id", "Building selection").from("selected_building_id").mandatory(),
              text("room_number", "Room number"),
              of("lease_start_date", "Lease start date", FieldType.DATE)
                  .from("lease_start_date", "preferred_move_in_date"),
              of("lease_end_date", "Lease end date", FieldType.DATE),
              of("operator_id", "Operator", FieldType.INTEGER),
              enumerated("booking_type", "Booking type", CatalogEnum.BOOKING_TYPES),
              of("deposit_amount", "Deposit amount", FieldType.DECIMAL)
                  .atLeast(0, "Deposit amount must be positive"),
              of("phone", "Phone number", FieldType.PHONE),
              enumerated("status", "Status", CatalogEnum.TENANT_STATUS).defaultsTo("ACTIVE"),
              enumerated("payment_status", "Payment status", CatalogEnum.PAYMENT_STATUS),
              enumerated(
                  "communication_preference",
                  "Communication preference",
                  CatalogEnum.COMMUNICATION_PREFERENCES),
              enumerated("account_status", "Account status", CatalogEnum.ACCOUNT_STATUS),
              text("emergency_contact_name", "Emergency contact name"),
              of("emergency_contact_phone", "Emergency contact phone", FieldType.PHONE),
              enumerated(
                  "emergency_contact_relation",
                  "Emergency contact relation",
                  CatalogEnum.EMERGENCY_CONTACT_RELATIONS),
              text("special_requests", "Special requests")));

  public static final EntitySchema LEAD =
      new EntitySchema(
          EntityKind.LEAD,
          List.of(
              id("lead_id", "Lead ID", IdPrefix.LEAD).mandatory(),
              of("email", "Email", FieldType.EMAIL).mandatory().lowercased(),
              enumerated("status", "Status", CatalogEnum.LEAD_STATUS)
                  .mandatory()
                  .defaultsTo("EXPLORING"),
              of("interaction_count", "Interaction count", FieldType.INTEGER)
                  .defaultsTo(0L)
                  .atLeast(0, "Interaction count cannot be negative"),
              of("lead_score", "Lead score", FieldType.INTEGER)
                  .defaultsTo(0L)
                  .between(0, 100, "Lead score must be between 0 and 100"),
              of("rooms_interested", "Rooms interested", FieldType.COLLECTION),
              of("showing_dates", "Showing dates", FieldType.COLLECTION),
              text("selected_room_id", "Selected room"),
              of("planned_move_in", "Planned move-in", FieldType.DATE)
                  .from("planned_move_in", "preferred_move_in_date"),
              of("planned_move_out", "Planned move-out", FieldType.DATE),
              of("preferred_move_in_date", "Preferred move-in date", FieldType.DATE),
              of("preferred_lease_term", "Preferred lease term", FieldType.INTEGER)
                  .atLeast(1, "Lease term must be at least 1 month"),
              enumerated("visa_status", "Visa status", CatalogEnum.VISA_STATUS),
              text("notes", "Notes"),
              text("additional_preferences", "Additional preferences"),
              of("budget_min", "Minimum budget", FieldType.DECIMAL)
                  .atLeast(0, "Minimum budget cannot be negative"),
              of("budget_max", "Maximum budget", FieldType.DECIMAL)
                  .atLeast(0, "Maximum budget cannot be negative"),
              enumerated("lead_source", "Lead source", CatalogEnum.LEAD_SOURCES),
              enumerated(
                      "preferred_communication",
                      "Preferred communication",
                      CatalogEnum.PREFERRED_COMMUNICATION)
                  .defaultsTo("EMAIL"),
              of("last_contacted", "Last contacted", FieldType.TIMESTAMP),
              of("next_follow_up", "Next follow-up", FieldType.TIMESTAMP),
              createdAt()));

  private EntitySchemas() {}

  public static EntitySchema forKind(EntityKind kind) {
    return switch (kind) {
      case OPERATOR -> OPERATOR;
      case BUILDING -> BUILDING;
      case ROOM -> ROOM;
      case TENANT -> TENANT;
      case LEAD -> LEAD;
    };
  }

  private static List<FieldSpec> buildingFields() {
    var fields = new ArrayList<FieldSpec>();
    fields.add(id("building_id", "Building ID", IdPrefix.BUILDING).mandatory());
    fields.add(text("building_name", "Building name").mandatory());
    fields.add(text("full_address", "Full address"));
    fields.add(text("street", "Street").from("street", "address"));
    fields.add(text("area", "Area"));
    fields.add(text("city", "City"));
    fields.add(text("state", "State"));
    fields.add(text("zip", "ZIP code").from("zip", "zip_code"));
    fields.add(of("operator_id", "Operator", FieldType.INTEGER));
    fields.add(bool("available", true));
    fields.add(
        of("floors", "Floors", FieldType.INTEGER)
            .atLeast(1, "Building must have at least 1 floor"));
    fields.add(
        of("total_rooms", "Total rooms", FieldType.INTEGER)
            .atLeast(1, "Building must have at least 1 room"));
    fields.add(
        of("total_bathrooms", "Total bathrooms", FieldType.INTEGER)
            .atLeast(0, "Total bathrooms cannot be negative"));
    fields.add(
        of("bathrooms_on_each_floor", "Bathrooms on each floor", FieldType.INTEGER)
            .atLeast(0, "Bathrooms per floor cannot be negative"));
    fields.add(of("priority", "Priority", FieldType.INTEGER));
    fields.add(
        of("min_lease_term", "Minimum lease term", FieldType.INTEGER)
            .atLeast(1, "Minimum lease term must be at least 1 month"));
    fields.add(
        of("pref_min_lease_term", "Preferred minimum lease term", FieldType.INTEGER)
            .atLeast(1, "Preferred minimum lease term must be at least 1 month"));
    for (String amenity :
        List.of(
            "wifi_included",
            "laundry_onsite",
            "secure_access",
            "bike_storage",
            "rooftop_access",
            "utilities_included",
            "fitness_area",
            "work_study_area",
            "social_events",
            "disability_access")) {
      fields.add(bool(amenity, false));
    }
    fields.add(
        enumerated("common_kitchen", "Common kitchen", CatalogEnum.COMMON_KITCHEN_OPTIONS));
    fields.add(text("common_area", "Common area"));
    fields.add(enumerated("pet_friendly", "Pet policy", CatalogEnum.PET_FRIENDLY_OPTIONS));
    fields.add(
        enumerated(
            "cleaning_common_spaces", "Cleaning schedule", CatalogEnum.CLEANING_SCHEDULES));
    for (String description :
        List.of(
            "nearby_conveniences_walk",
            "nearby_transportation",
            "building_rules",
            "amenities_details",
            "neighborhood_description",
            "building_description",
            "public_transit_info",
            "parking_info",
            "security_features",
            "disability_features")) {
      fields.add(text(description, description));
    }
    fields.add(
        of("building_images", "Building images", FieldType.COLLECTION)
            .from("building_images", "images"));
    fields.add(
        of("virtual_tour_url", "Virtual tour URL", FieldType.URL)
            .from("virtual_tour_url", "video_url"));
    fields.add(of("year_built", "Year built", FieldType.INTEGER));
    fields.add(of("last_renovation", "Last renovation", FieldType.INTEGER));
    fields.add(createdAt());
    return fields;
  }

  private static List<FieldSpec> roomFields() {
    var fields = new ArrayList<FieldSpec>();
    fields.add(id("room_id", "Room ID", IdPrefix.ROOM).mandatory());
    fields.add(text("room_number", "Room number").mandatory());
    fields.add(text("building_id", "Building selection").mandatory());
    fields.add(bool("ready_to_rent", true));
    fields.add(enumerated("status", "Status", CatalogEnum.ROOM_STATUS).defaultsTo("AVAILABLE"));
    fields.add(of("booked_from", "Booked from", FieldType.DATE));
    fields.add(of("booked_till", "Booked till", FieldType.DATE));
    fields.add(of("available_from", "Available from", FieldType.DATE));
    fields.add(
        of("active_tenants", "Active tenants", FieldType.INTEGER)
            .defaultsTo(0L)
            .atLeast(0, "Active tenants cannot be negative"));
    fields.add(
        of("maximum_people_in_room", "Maximum people", FieldType.INTEGER)
            .atLeast(1, "Maximum people must be at least 1"));
    fields.add(
        of("private_room_rent", "Private room rent", FieldType.DECIMAL)
            .mandatory()
            .atLeast(0, "Room rent must be a positive number"));
    fields.add(
        of("shared_room_rent_2", "Shared room rent", FieldType.DECIMAL)
            .atLeast(0, "Shared room rent must be a positive number"));
    fields.add(
        of("floor_number", "Floor number", FieldType.INTEGER)
            .atLeast(1, "Floor number must be at least 1"));
    fields.add(
        of("bed_count", "Bed count", FieldType.INTEGER)
            .atLeast(1, "Bed count must be at least 1"));
    fields.add(
        of("sq_footage", "Square footage", FieldType.INTEGER)
            .atLeast(1, "Square footage must be at least 1"));
    fields.add(enumerated("bathroom_type", "Bathroom type", CatalogEnum.BATHROOM_TYPES));
    fields.add(enumerated("bed_size", "Bed size", CatalogEnum.BED_SIZES));
    fields.add(enumerated("bed_type", "Bed type", CatalogEnum.BED_TYPES));
    fields.add(enumerated("view", "View", CatalogEnum.ROOM_VIEWS));
    fields.add(enumerated("room_storage", "Room storage", CatalogEnum.ROOM_STORAGE));
    fields.add(enumerated("noise_level", "Noise level", CatalogEnum.NOISE_LEVELS));
    fields.add(enumerated("sunlight", "Sunlight", CatalogEnum.SUNLIGHT_LEVELS));
    for (String amenity :
        List.of(
            "mini_fridge",
            "sink",
            "bedding_provided",
            "work_desk",
            "work_chair",
            "heating",
            "air_conditioning",
            "cable_tv",
            "furnished")) {
      fields.add(bool(amenity, false));
    }
    for (String note :
        List.of(
            "current_booking_types",
            "furniture_details",
            "public_notes",
            "internal_notes",
            "additional_features")) {
      fields.add(text(note, note));
    }
    fields.add(of("last_check", "Last check", FieldType.TIMESTAMP));
    fields.add(of("last_check_by", "Last checked by", FieldType.INTEGER));
    fields.add(of("last_renovation_date", "Last renovation date", FieldType.DATE));
    fields.add(
        of("room_images", "Room images", FieldType.COLLECTION).from("room_images", "images"));
    fields.add(of("virtual_tour_url", "Virtual tour URL", FieldType.URL));
    return fields;
  }

  private static FieldSpec bool(String name, boolean defaultValue) {
    return of(name, name, FieldType.BOOLEAN).defaultsTo(defaultValue);
  }

  private static FieldSpec createdAt() {
    return of("created_at", "Created at", FieldType.TIMESTAMP).defaultsTo(FieldDefault.now());
  }
}
