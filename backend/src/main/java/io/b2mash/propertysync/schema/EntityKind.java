package io.b2mash.propertysync.schema;

/** The five record kinds the backend accepts. */
public enum EntityKind {
  OPERATOR("Operator"),
  BUILDING("Building"),
  ROOM("Room"),
  TENANT("Tenant"),
  LEAD("Lead");

  private final String displayLabel;

  EntityKind(String displayLabel) {
    this.displayLabel = displayLabel;
  }

  public String getDisplayLabel() {
    return displayLabel;
  }
}
