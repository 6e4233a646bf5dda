package io.b2mash.propertysync.config;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.catalog.EnumCatalogLoader;
import java.time.Clock;
import java.util.Random;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties({
  PropertySyncConfig.IdProperties.class,
  PropertySyncConfig.CatalogProperties.class
})
public class PropertySyncConfig {

  @ConfigurationProperties("propertysync.ids")
  public record IdProperties(@DefaultValue("12") int tokenLength) {}

  @ConfigurationProperties("propertysync.catalog")
  public record CatalogProperties(@DefaultValue("classpath:enum-catalog.json") String location) {}

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  Random idRandom() {
    return new Random();
  }

  @Bean
  JsonMapper jsonMapper() {
    return JsonMapper.builder().build();
  }

  @Bean
  EnumCatalog enumCatalog(
      ObjectMapper objectMapper, ResourceLoader resourceLoader, CatalogProperties properties) {
    return new EnumCatalogLoader(objectMapper)
        .load(resourceLoader.getResource(properties.location()));
  }
}
