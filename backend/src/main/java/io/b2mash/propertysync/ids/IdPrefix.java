package io.b2mash.propertysync.ids;

/** Identifier prefixes for entities whose IDs are minted client-side. */
public enum IdPrefix {
  BUILDING("BLD"),
  ROOM("RM"),
  TENANT("TNT"),
  LEAD("LEAD");

  private final String value;

  IdPrefix(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
