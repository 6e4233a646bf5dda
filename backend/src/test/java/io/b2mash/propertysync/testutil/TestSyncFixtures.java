package io.b2mash.propertysync.testutil;

import io.b2mash.propertysync.catalog.EnumCatalog;
import io.b2mash.propertysync.catalog.EnumCatalogLoader;
import io.b2mash.propertysync.config.PropertySyncConfig.IdProperties;
import io.b2mash.propertysync.ids.IdGenerator;
import io.b2mash.propertysync.schema.CollectionCodec;
import io.b2mash.propertysync.sync.FormSyncService;
import io.b2mash.propertysync.transform.BuildingTransformer;
import io.b2mash.propertysync.transform.EntityTransformer;
import io.b2mash.propertysync.transform.LeadTransformer;
import io.b2mash.propertysync.transform.OperatorTransformer;
import io.b2mash.propertysync.transform.RoomTransformer;
import io.b2mash.propertysync.transform.TenantTransformer;
import io.b2mash.propertysync.validation.BuildingValidator;
import io.b2mash.propertysync.validation.EntityValidator;
import io.b2mash.propertysync.validation.LeadValidator;
import io.b2mash.propertysync.validation.OperatorValidator;
import io.b2mash.propertysync.validation.RoomValidator;
import io.b2mash.propertysync.validation.TenantValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import org.springframework.core.io.ClassPathResource;
import tools.jackson.databind.json.JsonMapper;

/** Shared wiring for unit tests: the real catalog, a fixed clock and a seeded ID generator. */
public final class TestSyncFixtures {

  /** 2025-06-15T10:00:00Z. */
  public static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);

  private static final EnumCatalog CATALOG =
      new EnumCatalogLoader(JsonMapper.builder().build())
          .load(new ClassPathResource("enum-catalog.json"));

  private TestSyncFixtures() {}

  public static EnumCatalog catalog() {
    return CATALOG;
  }

  public static IdGenerator idGenerator() {
    return new IdGenerator(new Random(42), new IdProperties(12));
  }

  public static CollectionCodec collectionCodec() {
    return new CollectionCodec(JsonMapper.builder().build());
  }

  public static List<EntityTransformer> transformers() {
    var ids = idGenerator();
    var codec = collectionCodec();
    return List.of(
        new OperatorTransformer(ids, codec, FIXED_CLOCK),
        new BuildingTransformer(ids, codec, FIXED_CLOCK),
        new RoomTransformer(ids, codec, FIXED_CLOCK),
        new TenantTransformer(ids, codec, FIXED_CLOCK),
        new LeadTransformer(ids, codec, FIXED_CLOCK));
  }

  public static List<EntityValidator> validators() {
    return List.of(
        new OperatorValidator(CATALOG),
        new BuildingValidator(CATALOG, FIXED_CLOCK),
        new RoomValidator(CATALOG),
        new TenantValidator(CATALOG),
        new LeadValidator(CATALOG));
  }

  public static FormSyncService formSyncService() {
    return new FormSyncService(transformers(), validators());
  }
}
