package io.b2mash.propertysync.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads the enumeration catalog from a JSON resource of the form {@code {"ROOM_STATUS":
 * ["AVAILABLE", ...], ...}}. Unknown keys are ignored; missing or empty enumerations fail the load.
 */
public class EnumCatalogLoader {

  private static final Logger log = LoggerFactory.getLogger(EnumCatalogLoader.class);

  private static final TypeReference<Map<String, List<String>>> CATALOG_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public EnumCatalogLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public EnumCatalog load(Resource resource) {
    Map<String, List<String>> raw;
    try (InputStream in = resource.getInputStream()) {
      raw = objectMapper.readValue(in, CATALOG_TYPE);
    } catch (IOException | JacksonException e) {
      throw new IllegalStateException(
          "Failed to read enum catalog: " + resource.getDescription(), e);
    }

    var vocabularies = new EnumMap<CatalogEnum, List<String>>(CatalogEnum.class);
    for (var entry : raw.entrySet()) {
      CatalogEnum enumeration;
      try {
        enumeration = CatalogEnum.fromKey(entry.getKey());
      } catch (IllegalArgumentException e) {
        log.warn(
            "Ignoring unknown enumeration {} in {}", entry.getKey(), resource.getDescription());
        continue;
      }
      vocabularies.put(enumeration, entry.getValue());
    }

    var catalog = new EnumCatalog(vocabularies);
    log.info("Loaded {} enumerations from {}", vocabularies.size(), resource.getDescription());
    return catalog;
  }
}
