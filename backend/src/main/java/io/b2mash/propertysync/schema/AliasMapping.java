package io.b2mash.propertysync.schema;

/**
 * One row of an entity's alias table: a form key and the canonical field it feeds.
 *
 * @param alias form key as sent by the UI (current or historical name)
 * @param canonicalField backend field name
 */
public record AliasMapping(String alias, String canonicalField) {}
