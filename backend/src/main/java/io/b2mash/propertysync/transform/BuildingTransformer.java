package io.b2mash.propertysync.transform;

import io.b2mash.propertysync.ids.IdGenerator;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.CollectionCodec;
import io.b2mash.propertysync.schema.EntitySchemas;
import io.b2mash.propertysync.schema.FieldSpec;
import io.b2mash.propertysync.schema.ValueCoercion;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class BuildingTransformer extends SchemaDrivenTransformer {

  private static final List<String> ADDRESS_PARTS =
      List.of("street", "area", "city", "state", "zip");

  public BuildingTransformer(
      IdGenerator idGenerator, CollectionCodec collectionCodec, Clock clock) {
    super(EntitySchemas.BUILDING, idGenerator, collectionCodec, clock);
  }

  @Override
  protected Object resolveSource(FieldSpec spec, Map<String, ?> raw) {
    return switch (spec.name()) {
      case "full_address" -> fullAddress(raw);
      case "pet_friendly" -> petPolicy(super.resolveSource(spec, raw));
      default -> super.resolveSource(spec, raw);
    };
  }

  @Override
  public Map<String, Object> toFormState(CanonicalRecord record) {
    var form = super.toFormState(record);
    form.put("images", form.get("building_images"));
    form.put("video_url", record.get("virtual_tour_url"));
    form.put("pet_friendly", petPolicy(record.get("pet_friendly")));
    return form;
  }

  /** A supplied full address wins; otherwise it is joined from whichever parts are present. */
  private String fullAddress(Map<String, ?> raw) {
    var supplied = ValueCoercion.toText(raw.get("full_address"), false);
    if (supplied != null) {
      return supplied;
    }
    var joined =
        ADDRESS_PARTS.stream()
            .map(part -> ValueCoercion.toText(schema().resolve(raw, part), false))
            .filter(Objects::nonNull)
            .collect(Collectors.joining(", "));
    return joined.isEmpty() ? null : joined;
  }

  /** Older rows stored the pet policy as a boolean. */
  private static Object petPolicy(Object value) {
    if (value instanceof Boolean allowed) {
      return allowed ? "Yes" : "No";
    }
    return value;
  }
}
