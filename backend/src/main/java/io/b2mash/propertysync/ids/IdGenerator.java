package io.b2mash.propertysync.ids;

import io.b2mash.propertysync.config.PropertySyncConfig.IdProperties;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mints {@code PREFIX_TOKEN} identifiers where TOKEN is a fixed-length run of uppercase letters and
 * digits. Tokens come from a non-cryptographic source and are only unlikely to collide within a
 * session; uniqueness across sessions is enforced by the store that persists the record.
 */
@Component
public class IdGenerator {

  private static final Logger log = LoggerFactory.getLogger(IdGenerator.class);
  private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

  private final Random random;
  private final int tokenLength;

  public IdGenerator(Random random, IdProperties properties) {
    if (properties.tokenLength() < 1) {
      throw new IllegalArgumentException("propertysync.ids.token-length must be positive");
    }
    this.random = random;
    this.tokenLength = properties.tokenLength();
  }

  public String generateId(IdPrefix prefix) {
    return generateId(prefix.getValue());
  }

  public String generateId(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("ID prefix must not be blank");
    }
    var token = new char[tokenLength];
    for (int i = 0; i < tokenLength; i++) {
      token[i] = ALPHABET[random.nextInt(ALPHABET.length)];
    }
    var id = prefix + "_" + new String(token);
    log.debug("Generated id {}", id);
    return id;
  }

  /** Returns {@code existing} untouched when it is non-blank, otherwise a fresh ID. */
  public String assignIfAbsent(Object existing, IdPrefix prefix) {
    if (existing != null && !existing.toString().isBlank()) {
      return existing.toString().trim();
    }
    return generateId(prefix);
  }

  public int getTokenLength() {
    return tokenLength;
  }
}
