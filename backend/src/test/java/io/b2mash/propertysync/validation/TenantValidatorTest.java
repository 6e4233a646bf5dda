package io.b2mash.propertysync.validation;

import static io.b2mash.propertysync.testutil.TestSyncFixtures.FIXED_CLOCK;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.propertysync.testutil.TestSyncFixtures;
import io.b2mash.propertysync.transform.TenantTransformer;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TenantValidatorTest {

  private final TenantTransformer transformer =
      new TenantTransformer(
          TestSyncFixtures.idGenerator(), TestSyncFixtures.collectionCodec(), FIXED_CLOCK);
  private final TenantValidator validator = new TenantValidator(TestSyncFixtures.catalog());

  @Test
  void emptyFormIsMissingFormFields() {
    var result = validate(Map.of());

    assertThat(result.valid()).isFalse();
    assertThat(result.missingRequired())
        .containsExactly("tenant_name", "tenant_email", "room_id", "building_id");
  }

  @Test
  void completeTenantSubmissionIsValid() {
    var raw = new HashMap<String, Object>();
    raw.put("tenant_name", "John Doe");
    raw.put("tenant_email", "john@example.com");
    raw.put("tenant_nationality", "American");
    raw.put("room_id", "ROOM_001");
    raw.put("building_id", "BLDG_001");
    raw.put("operator_id", 1);
    raw.put("booking_type", "LEASE");
    raw.put("lease_start_date", "2024-01-01");
    raw.put("lease_end_date", "2024-12-31");
    raw.put("deposit_amount", 1000);

    var result = validate(raw);

    assertThat(result.valid()).isTrue();
    assertThat(result.errors()).isEmpty();
    assertThat(result.missingRequired()).isEmpty();
  }

  @ParameterizedTest
  @CsvSource({"2024-06-01, 2024-06-01", "2024-06-01, 2024-05-31", "2024-06-01, 2023-12-31"})
  void leaseEndOnOrBeforeStartIsRejected(String start, String end) {
    var result = validate(lease(start, end));

    assertThat(result.valid()).isFalse();
    assertThat(result.errors())
        .containsExactly(Map.entry("lease_end_date", "Lease end date must be after start date"));
  }

  @ParameterizedTest
  @CsvSource({"2024-06-01, 2024-06-02", "2024-01-01, 2024-12-31", "2024-12-31, 2025-01-01"})
  void leaseEndAfterStartIsAccepted(String start, String end) {
    var result = validate(lease(start, end));

    assertThat(result.valid()).isTrue();
  }

  @Test
  void impossibleDateIsAFormatError() {
    var result = validate(lease("2024-02-30", "2024-12-31"));

    assertThat(result.errors())
        .containsExactly(
            Map.entry("lease_start_date", "Invalid date format (use YYYY-MM-DD)"));
  }

  @Test
  void lowercaseBookingTypeIsRejected() {
    var raw = lease("2024-01-01", "2024-12-31");
    raw.put("booking_type", "lease");

    assertThat(validate(raw).errors()).containsEntry("booking_type", "Invalid booking type");
  }

  @Test
  void nationalityIsFreeText() {
    var raw = lease("2024-01-01", "2024-12-31");
    raw.put("nationality", "Kenyan");

    assertThat(validate(raw).valid()).isTrue();
  }

  @Test
  void negativeDepositIsRejected() {
    var raw = lease("2024-01-01", "2024-12-31");
    raw.put("deposit_amount", "-1");

    assertThat(validate(raw).errors())
        .containsEntry("deposit_amount", "Deposit amount must be positive");
  }

  @Test
  void malformedTenantEmailAsksForValidAddress() {
    var raw = lease("2024-01-01", "2024-12-31");
    raw.put("tenant_email", "john@example");

    assertThat(validate(raw).errors())
        .containsOnly(Map.entry("tenant_email", "Please enter a valid email address"));
  }

  @Test
  void legacyEmailKeySatisfiesRequiredEmail() {
    var raw = lease("2024-01-01", "2024-12-31");
    raw.remove("tenant_email");
    raw.put("email", "legacy@example.com");

    assertThat(validate(raw).valid()).isTrue();
  }

  private static Map<String, Object> lease(String start, String end) {
    var raw = new HashMap<String, Object>();
    raw.put("tenant_name", "John Doe");
    raw.put("tenant_email", "john@example.com");
    raw.put("room_id", "ROOM_001");
    raw.put("building_id", "BLDG_001");
    raw.put("lease_start_date", start);
    raw.put("lease_end_date", end);
    return raw;
  }

  private ValidationResult validate(Map<String, ?> raw) {
    return validator.validate(transformer.transform(raw));
  }
}
