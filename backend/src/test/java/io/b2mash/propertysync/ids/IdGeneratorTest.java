package io.b2mash.propertysync.ids;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.propertysync.config.PropertySyncConfig.IdProperties;
import java.util.HashSet;
import java.util.Random;
import org.junit.jupiter.api.Test;

class IdGeneratorTest {

  private final IdGenerator generator = new IdGenerator(new Random(7), new IdProperties(12));

  @Test
  void generatedIdsMatchPrefixTokenFormat() {
    for (IdPrefix prefix : IdPrefix.values()) {
      var id = generator.generateId(prefix);

      assertThat(id).matches("^" + prefix.getValue() + "_[A-Z0-9]{12}$");
    }
  }

  @Test
  void consecutiveIdsDiffer() {
    var seen = new HashSet<String>();
    for (int i = 0; i < 1_000; i++) {
      seen.add(generator.generateId(IdPrefix.TENANT));
    }

    assertThat(seen).hasSize(1_000);
  }

  @Test
  void entityPrefixesMatchBackendConvention() {
    assertThat(generator.generateId(IdPrefix.TENANT)).startsWith("TNT_");
    assertThat(generator.generateId(IdPrefix.LEAD)).startsWith("LEAD_");
    assertThat(generator.generateId(IdPrefix.BUILDING)).startsWith("BLD_");
    assertThat(generator.generateId(IdPrefix.ROOM)).startsWith("RM_");
  }

  @Test
  void acceptsCustomPrefix() {
    assertThat(generator.generateId("OPS")).matches("^OPS_[A-Z0-9]{12}$");
  }

  @Test
  void blankPrefixIsRejected() {
    assertThatThrownBy(() -> generator.generateId(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> generator.generateId((String) null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void tokenLengthIsConfigurable() {
    var shortIds = new IdGenerator(new Random(1), new IdProperties(6));

    assertThat(shortIds.generateId(IdPrefix.ROOM)).matches("^RM_[A-Z0-9]{6}$");
    assertThat(shortIds.getTokenLength()).isEqualTo(6);
  }

  @Test
  void nonPositiveTokenLengthIsRejected() {
    assertThatThrownBy(() -> new IdGenerator(new Random(), new IdProperties(0)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void assignIfAbsentKeepsExistingId() {
    assertThat(generator.assignIfAbsent("TNT_EXISTING0001", IdPrefix.TENANT))
        .isEqualTo("TNT_EXISTING0001");
    assertThat(generator.assignIfAbsent("  BLDG_001 ", IdPrefix.BUILDING)).isEqualTo("BLDG_001");
  }

  @Test
  void assignIfAbsentGeneratesForBlankOrNull() {
    assertThat(generator.assignIfAbsent(null, IdPrefix.LEAD)).startsWith("LEAD_");
    assertThat(generator.assignIfAbsent("", IdPrefix.LEAD)).startsWith("LEAD_");
  }
}
