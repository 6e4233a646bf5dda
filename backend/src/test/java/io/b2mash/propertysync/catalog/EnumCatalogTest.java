package io.b2mash.propertysync.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.propertysync.testutil.TestSyncFixtures;
import java.util.EnumMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnumCatalogTest {

  private final EnumCatalog catalog = TestSyncFixtures.catalog();

  @Test
  void everyDeclaredValueIsAMember() {
    for (CatalogEnum enumeration : CatalogEnum.values()) {
      assertThat(catalog.values(enumeration)).isNotEmpty();
      for (String value : catalog.values(enumeration)) {
        assertThat(catalog.isMember(enumeration, value))
            .as("%s contains %s", enumeration, value)
            .isTrue();
        assertThat(catalog.isMember(enumeration.name(), value)).isTrue();
      }
    }
  }

  @Test
  void undeclaredValueIsNotAMember() {
    for (CatalogEnum enumeration : CatalogEnum.values()) {
      assertThat(catalog.isMember(enumeration, "NOT_A_VALUE")).isFalse();
    }
  }

  @Test
  void membershipIsCaseSensitiveAndExact() {
    assertThat(catalog.isMember(CatalogEnum.ROOM_STATUS, "AVAILABLE")).isTrue();
    assertThat(catalog.isMember(CatalogEnum.ROOM_STATUS, "available")).isFalse();
    assertThat(catalog.isMember(CatalogEnum.ROOM_STATUS, " AVAILABLE")).isFalse();
    assertThat(catalog.isMember(CatalogEnum.BATHROOM_TYPES, "En-Suite")).isTrue();
    assertThat(catalog.isMember(CatalogEnum.BATHROOM_TYPES, null)).isFalse();
  }

  @Test
  void valuesKeepDeclarationOrder() {
    assertThat(catalog.values(CatalogEnum.BOOKING_TYPES))
        .containsExactly("LEASE", "CORPORATE", "STUDENT");
    assertThat(catalog.values("NOISE_LEVELS")).containsExactly("QUIET", "MODERATE", "LIVELY");
  }

  @Test
  void unknownEnumerationNameIsRejected() {
    assertThatThrownBy(() -> catalog.isMember("NO_SUCH_ENUM", "X"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("NO_SUCH_ENUM");
  }

  @Test
  void catalogRequiresEveryEnumeration() {
    var partial = new EnumMap<CatalogEnum, List<String>>(CatalogEnum.class);
    partial.put(CatalogEnum.ROOM_STATUS, List.of("AVAILABLE"));

    assertThatThrownBy(() -> new EnumCatalog(partial))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("has no declared values");
  }

  @Test
  void catalogIsNotAffectedByLaterChangesToItsSource() {
    var source = new EnumMap<CatalogEnum, List<String>>(CatalogEnum.class);
    for (CatalogEnum enumeration : CatalogEnum.values()) {
      source.put(enumeration, List.of("ONLY"));
    }
    var built = new EnumCatalog(source);
    source.put(CatalogEnum.ROOM_STATUS, List.of("CHANGED"));

    assertThat(built.isMember(CatalogEnum.ROOM_STATUS, "ONLY")).isTrue();
    assertThat(built.isMember(CatalogEnum.ROOM_STATUS, "CHANGED")).isFalse();
    assertThatThrownBy(() -> built.values(CatalogEnum.ROOM_STATUS).add("X"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
