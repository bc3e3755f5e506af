package com.dview.profiler.service.profiling.inference;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Converts cell values to {@link LocalDateTime}. Zoned and offset values are normalized to UTC, and
 * plain dates map to the start of the day.
 */
public final class DateTimeCoercion {

  public static final List<DateTimeFormatter> DEFAULT_FORMATTERS =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          DateTimeFormatter.ISO_OFFSET_DATE_TIME,
          DateTimeFormatter.ISO_LOCAL_DATE,
          DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]", Locale.ENGLISH),
          DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ENGLISH),
          DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ENGLISH),
          DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss", Locale.ENGLISH),
          DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH));

  private DateTimeCoercion() {}

  public static Coercion<LocalDateTime> toDateTime(Object value) {
    return toDateTime(value, DEFAULT_FORMATTERS);
  }

  /** Tries {@code preferred} before the default formats. */
  public static Coercion<LocalDateTime> toDateTime(Object value, DateTimeFormatter preferred) {
    if (preferred == null) {
      return toDateTime(value);
    }
    List<DateTimeFormatter> formatters = new ArrayList<>(DEFAULT_FORMATTERS.size() + 1);
    formatters.add(preferred);
    formatters.addAll(DEFAULT_FORMATTERS);
    return toDateTime(value, formatters);
  }

  public static Coercion<LocalDateTime> toDateTime(
      Object value, List<DateTimeFormatter> formatters) {
    if (value == null) {
      return Coercion.failure("null value");
    }
    if (value instanceof LocalDateTime) {
      return Coercion.success((LocalDateTime) value);
    }
    if (value instanceof LocalDate) {
      return Coercion.success(((LocalDate) value).atStartOfDay());
    }
    if (value instanceof OffsetDateTime) {
      return Coercion.success(
          ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }
    if (value instanceof ZonedDateTime) {
      return Coercion.success(
          ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }
    if (value instanceof Instant) {
      return Coercion.success(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
    }
    if (value instanceof java.sql.Timestamp) {
      return Coercion.success(((java.sql.Timestamp) value).toLocalDateTime());
    }
    if (value instanceof java.sql.Date) {
      return Coercion.success(((java.sql.Date) value).toLocalDate().atStartOfDay());
    }
    if (value instanceof Date) {
      return Coercion.success(LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC));
    }
    if (value instanceof Number || value instanceof Boolean) {
      return Coercion.failure("not a date: " + value);
    }

    String text = value.toString().trim();
    if (text.isEmpty()) {
      return Coercion.failure("blank text");
    }
    String lastError = "no formats to try";
    for (DateTimeFormatter formatter : formatters) {
      try {
        TemporalAccessor parsed =
            formatter.parseBest(
                text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        return Coercion.success(normalize(parsed));
      } catch (DateTimeParseException e) {
        lastError = e.getMessage();
      }
    }
    return Coercion.failure(lastError);
  }

  private static LocalDateTime normalize(TemporalAccessor parsed) {
    if (parsed instanceof OffsetDateTime) {
      return ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    if (parsed instanceof LocalDateTime) {
      return (LocalDateTime) parsed;
    }
    return ((LocalDate) parsed).atStartOfDay();
  }
}
