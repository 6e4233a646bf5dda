package io.b2mash.propertysync.catalog;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable registry of the closed vocabularies the backend accepts. Matching is exact and
 * case-sensitive: a value is a member only if it is byte-for-byte one of the declared values.
 */
public final class EnumCatalog {

  private final Map<CatalogEnum, List<String>> orderedValues;
  private final Map<CatalogEnum, Set<String>> lookup;

  public EnumCatalog(Map<CatalogEnum, List<String>> vocabularies) {
    var ordered = new EnumMap<CatalogEnum, List<String>>(CatalogEnum.class);
    var sets = new EnumMap<CatalogEnum, Set<String>>(CatalogEnum.class);
    for (CatalogEnum enumeration : CatalogEnum.values()) {
      List<String> values = vocabularies.get(enumeration);
      if (values == null || values.isEmpty()) {
        throw new IllegalStateException(
            "Enumeration " + enumeration.name() + " has no declared values");
      }
      ordered.put(enumeration, List.copyOf(values));
      sets.put(enumeration, Collections.unmodifiableSet(new LinkedHashSet<>(values)));
    }
    this.orderedValues = Collections.unmodifiableMap(ordered);
    this.lookup = Collections.unmodifiableMap(sets);
  }

  public boolean isMember(CatalogEnum enumeration, String value) {
    if (value == null) {
      return false;
    }
    return lookup.get(enumeration).contains(value);
  }

  /**
   * String-keyed variant of {@link #isMember(CatalogEnum, String)}.
   *
   * @throws IllegalArgumentException if {@code enumName} is not a catalog key
   */
  public boolean isMember(String enumName, String value) {
    return isMember(CatalogEnum.fromKey(enumName), value);
  }

  /** Returns the declared values of an enumeration in declaration order. */
  public List<String> values(CatalogEnum enumeration) {
    return orderedValues.get(enumeration);
  }

  public List<String> values(String enumName) {
    return values(CatalogEnum.fromKey(enumName));
  }
}
