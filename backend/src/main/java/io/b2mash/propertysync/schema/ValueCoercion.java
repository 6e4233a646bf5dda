package io.b2mash.propertysync.schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient conversions from loosely typed form values. None of these throw: input that cannot be
 * converted is returned as its trimmed string so the validator can report it.
 */
public final class ValueCoercion {

  private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "off");
  private static final int MAX_LONG_DIGITS = 19;

  private ValueCoercion() {}

  /** A value is present unless it is null or a blank string. */
  public static boolean isPresent(Object value) {
    if (value == null) {
      return false;
    }
    return !(value instanceof String str) || !str.isBlank();
  }

  public static String toText(Object value, boolean lowercase) {
    if (!isPresent(value)) {
      return null;
    }
    String text = value.toString().trim();
    return lowercase ? text.toLowerCase(Locale.ROOT) : text;
  }

  /**
   * Whole numbers as {@link Long}; fractional input is truncated toward zero. Numbers whose
   * integer part does not fit a {@code long} stay {@link BigDecimal} so the validator can report
   * them out of range.
   */
  public static Object toInteger(Object value) {
    Object decimal = toDecimal(value);
    if (!(decimal instanceof BigDecimal number)) {
      return decimal;
    }
    int integerDigits = number.precision() - number.scale();
    if (number.signum() == 0 || integerDigits <= 0) {
      return 0L;
    }
    if (integerDigits > MAX_LONG_DIGITS) {
      return number;
    }
    try {
      return number.setScale(0, RoundingMode.DOWN).longValueExact();
    } catch (ArithmeticException e) {
      return number;
    }
  }

  public static Object toDecimal(Object value) {
    if (!isPresent(value)) {
      return null;
    }
    if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
      return null;
    }
    if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
      return null;
    }
    if (value instanceof BigDecimal number) {
      return number;
    }
    if (value instanceof Number number) {
      return new BigDecimal(number.toString());
    }
    String text = value.toString().trim();
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return text;
    }
  }

  /**
   * Booleans pass through, numbers are true when non-zero, and strings are true unless they read
   * as one of {@code false}, {@code 0}, {@code no}, {@code off}. Absent input takes the default.
   */
  public static boolean toBoolean(Object value, boolean defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof Number number) {
      return new BigDecimal(number.toString()).signum() != 0;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    if (text.isEmpty()) {
      return defaultValue;
    }
    return !FALSE_WORDS.contains(text);
  }
}
