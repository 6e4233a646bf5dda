package io.b2mash.propertysync.workflow;

import io.b2mash.propertysync.schema.EntityKind;

/** The five forms, each backed by one entity kind. */
public enum WorkflowStep {
  OPERATOR("operator", EntityKind.OPERATOR),
  BUILDING("building", EntityKind.BUILDING),
  ROOM("room", EntityKind.ROOM),
  TENANT("tenant", EntityKind.TENANT),
  LEAD("lead", EntityKind.LEAD);

  private final String id;
  private final EntityKind entityKind;

  WorkflowStep(String id, EntityKind entityKind) {
    this.id = id;
    this.entityKind = entityKind;
  }

  public String getId() {
    return id;
  }

  public EntityKind getEntityKind() {
    return entityKind;
  }
}
