package com.mk.fx.context.engine.analyzer;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/** Parses the ISO date and date-time strings stored for cases, events and deadlines (UTC). */
@Slf4j
final class CaseDates {

  private static final List<Function<String, Instant>> FORMATS =
      List.of(
          text -> OffsetDateTime.parse(text).toInstant(),
          text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
          text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

  private CaseDates() {}

  /** The instant for an ISO value, or null when it is blank or in no known format. */
  static Instant parse(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    var text = value.trim();
    DateTimeParseException lastFailure = null;
    for (Function<String, Instant> format : FORMATS) {
      try {
        return format.apply(text);
      } catch (DateTimeParseException e) {
        lastFailure = e;
      }
    }
    log.debug("Ignoring unparseable date '{}': {}", text, lastFailure.getMessage());
    return null;
  }
}
