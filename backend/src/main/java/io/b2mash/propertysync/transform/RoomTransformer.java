package io.b2mash.propertysync.transform;

import io.b2mash.propertysync.ids.IdGenerator;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.CollectionCodec;
import io.b2mash.propertysync.schema.EntitySchemas;
import java.time.Clock;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class RoomTransformer extends SchemaDrivenTransformer {

  public RoomTransformer(IdGenerator idGenerator, CollectionCodec collectionCodec, Clock clock) {
    super(EntitySchemas.ROOM, idGenerator, collectionCodec, clock);
  }

  @Override
  public Map<String, Object> toFormState(CanonicalRecord record) {
    var form = super.toFormState(record);
    form.put("images", form.get("room_images"));
    return form;
  }
}
