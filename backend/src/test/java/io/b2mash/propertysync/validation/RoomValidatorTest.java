package io.b2mash.propertysync.validation;

import static io.b2mash.propertysync.testutil.TestSyncFixtures.FIXED_CLOCK;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.propertysync.testutil.TestSyncFixtures;
import io.b2mash.propertysync.transform.RoomTransformer;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RoomValidatorTest {

  private final RoomTransformer transformer =
      new RoomTransformer(
          TestSyncFixtures.idGenerator(), TestSyncFixtures.collectionCodec(), FIXED_CLOCK);
  private final RoomValidator validator = new RoomValidator(TestSyncFixtures.catalog());

  @Test
  void emptyFormIsMissingFormFields() {
    var result = validate(Map.of());

    assertThat(result.missingRequired())
        .containsExactly("room_number", "building_id", "private_room_rent");
    assertThat(result.errors()).containsEntry("private_room_rent", "Private room rent is required");
  }

  @Test
  void minimalRoomIsValid() {
    var result = validate(room());

    assertThat(result.valid()).isTrue();
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  void negativeRentIsRejected() {
    var raw = room();
    raw.put("private_room_rent", -5);

    assertThat(validate(raw).errors())
        .containsEntry("private_room_rent", "Room rent must be a positive number");
  }

  @Test
  void zeroRentIsAccepted() {
    var raw = room();
    raw.put("private_room_rent", 0);

    assertThat(validate(raw).valid()).isTrue();
  }

  @Test
  void nonNumericRentIsAFormatError() {
    var raw = room();
    raw.put("private_room_rent", "cheap");

    var result = validate(raw);

    assertThat(result.missingRequired()).isEmpty();
    assertThat(result.errors())
        .containsEntry("private_room_rent", "Private room rent must be a valid number");
  }

  @Test
  void lowercaseStatusIsRejected() {
    var raw = room();
    raw.put("status", "available");

    assertThat(validate(raw).errors()).containsEntry("status", "Invalid room status");
  }

  @Test
  void bookingMustEndAfterItStarts() {
    var raw = room();
    raw.put("booked_from", "2025-07-01");
    raw.put("booked_till", "2025-07-01");

    assertThat(validate(raw).errors()).containsKey("booked_till");

    raw.put("booked_till", "2025-07-31");
    assertThat(validate(raw).valid()).isTrue();
  }

  @Test
  void malformedDateIsReportedOnceAsFormatError() {
    var raw = room();
    raw.put("booked_from", "2025-07-01");
    raw.put("booked_till", "07/31/2025");

    var result = validate(raw);

    assertThat(result.errors())
        .containsExactly(Map.entry("booked_till", "Invalid date format (use YYYY-MM-DD)"));
  }

  @Test
  void occupiedRoomWithoutTenantsWarns() {
    var raw = room();
    raw.put("status", "OCCUPIED");

    var result = validate(raw);

    assertThat(result.valid()).isTrue();
    assertThat(result.warnings()).containsKey("active_tenants");
  }

  @Test
  void availableRoomWithTenantsWarns() {
    var raw = room();
    raw.put("active_tenants", 2);

    assertThat(validate(raw).warnings()).containsKey("status");
  }

  @Test
  void availableRoomNotReadyToRentWarns() {
    var raw = room();
    raw.put("ready_to_rent", false);

    assertThat(validate(raw).warnings()).containsKey("ready_to_rent");
  }

  private static Map<String, Object> room() {
    var raw = new HashMap<String, Object>();
    raw.put("room_number", "101");
    raw.put("building_id", "BLD_MAPLE0000001");
    raw.put("private_room_rent", 950);
    return raw;
  }

  private ValidationResult validate(Map<String, ?> raw) {
    return validator.validate(transformer.transform(raw));
  }
}
