package io.b2mash.propertysync.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

class EnumCatalogLoaderTest {

  private final ObjectMapper objectMapper = JsonMapper.builder().build();
  private final EnumCatalogLoader loader = new EnumCatalogLoader(objectMapper);

  @Test
  void loadsBundledCatalog() {
    var catalog = loader.load(new ClassPathResource("enum-catalog.json"));

    assertThat(catalog.isMember(CatalogEnum.LEAD_STATUS, "EXPLORING")).isTrue();
    assertThat(catalog.values(CatalogEnum.LEAD_STATUS)).hasSize(11);
  }

  @Test
  void ignoresUnknownEnumerations() {
    var content = new LinkedHashMap<String, List<String>>();
    for (CatalogEnum enumeration : CatalogEnum.values()) {
      content.put(enumeration.name(), List.of("A", "B"));
    }
    content.put("LEGACY_FLAGS", List.of("OLD"));

    var catalog = loader.load(resource(objectMapper.writeValueAsString(content)));

    assertThat(catalog.values(CatalogEnum.BED_SIZES)).containsExactly("A", "B");
  }

  @Test
  void missingEnumerationFailsTheLoad() {
    var content = new LinkedHashMap<String, List<String>>();
    content.put("ROOM_STATUS", List.of("AVAILABLE"));

    assertThatThrownBy(() -> loader.load(resource(objectMapper.writeValueAsString(content))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void malformedJsonFailsTheLoad() {
    assertThatThrownBy(() -> loader.load(resource("{\"ROOM_STATUS\": [")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Failed to read enum catalog");
  }

  @Test
  void missingResourceFailsTheLoad() {
    assertThatThrownBy(() -> loader.load(new ClassPathResource("no-such-catalog.json")))
        .isInstanceOf(IllegalStateException.class);
  }

  private static ByteArrayResource resource(String json) {
    return new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8), "test catalog");
  }
}
