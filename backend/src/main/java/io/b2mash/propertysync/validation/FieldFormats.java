package io.b2mash.propertysync.validation;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/** Format checks shared by every entity validator. */
public final class FieldFormats {

  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
  private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
  private static final Pattern NON_DIGITS = Pattern.compile("\\D");
  private static final int MIN_PHONE_DIGITS = 10;
  private static final int MAX_PHONE_DIGITS = 15;

  private FieldFormats() {}

  public static boolean isValidEmail(String value) {
    return value != null && EMAIL.matcher(value).matches();
  }

  /** 10 to 15 digits once separators, spaces and a leading {@code +} are stripped. */
  public static boolean isValidPhone(String value) {
    if (value == null) {
      return false;
    }
    int digits = NON_DIGITS.matcher(value).replaceAll("").length();
    return digits >= MIN_PHONE_DIGITS && digits <= MAX_PHONE_DIGITS;
  }

  public static boolean isValidDate(String value) {
    return parseDate(value).isPresent();
  }

  /**
   * Parses a strict {@code YYYY-MM-DD} calendar date. Values such as {@code 2024-02-30} or {@code
   * 2024-1-5} are rejected.
   */
  public static Optional<LocalDate> parseDate(String value) {
    if (value == null || !ISO_DATE.matcher(value).matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  public static boolean isValidUrl(String value) {
    return value != null && (value.startsWith("http://") || value.startsWith("https://"));
  }
}
