package com.github.simbo1905.brs;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Objects;

/// A five-field schedule expression: `minute hour day-of-month month day-of-week`.
///
/// Each field accepts `*`, a number, a range `a-b`, a step `*/n` or `a-b/n`, and comma
/// separated lists of those. Day of week runs 0-7 with both 0 and 7 meaning Sunday. When both
/// day fields are restricted a day matches if either does.
///
/// The names `hourly`, `daily` and `weekly` stand for `0 * * * *`, `0 2 * * *` and
/// `0 2 * * 0`.
public final class CronSchedule {

  public static final String HOURLY = "0 * * * *";
  public static final String DAILY = "0 2 * * *";
  public static final String WEEKLY = "0 2 * * 0";

  /// A match is always found within this many years if the fields can match at all.
  private static final int SEARCH_YEARS = 8;

  private final String expression;
  private final BitSet minutes;
  private final BitSet hours;
  private final BitSet daysOfMonth;
  private final BitSet months;
  private final BitSet daysOfWeek;
  private final boolean daysOfMonthRestricted;
  private final boolean daysOfWeekRestricted;

  private CronSchedule(String expression, String[] fields) {
    this.expression = expression;
    this.minutes = parseField(fields[0], 0, 59, "minute");
    this.hours = parseField(fields[1], 0, 23, "hour");
    this.daysOfMonth = parseField(fields[2], 1, 31, "day-of-month");
    this.months = parseField(fields[3], 1, 12, "month");
    this.daysOfWeek = parseField(fields[4], 0, 7, "day-of-week");
    if (daysOfWeek.get(7)) {
      daysOfWeek.set(0);
    }
    this.daysOfMonthRestricted = !fields[2].equals("*");
    this.daysOfWeekRestricted = !fields[4].equals("*");
  }

  /// Parses a named interval (`hourly`, `daily`, `weekly`) or a five-field expression.
  ///
  /// @throws IllegalArgumentException if the expression is malformed
  public static CronSchedule parse(String interval) {
    Objects.requireNonNull(interval, "interval");
    final var trimmed = interval.trim();
    final String expression;
    switch (trimmed.toLowerCase(Locale.ROOT)) {
      case "hourly":
        expression = HOURLY;
        break;
      case "daily":
        expression = DAILY;
        break;
      case "weekly":
        expression = WEEKLY;
        break;
      default:
        expression = trimmed;
    }
    final var fields = expression.split("\\s+");
    if (fields.length != 5) {
      throw new IllegalArgumentException(
          "Schedule expression must have 5 fields, got '" + interval + "'");
    }
    return new CronSchedule(expression, fields);
  }

  public String expression() {
    return expression;
  }

  /// The first matching minute strictly after `after`, in the same zone.
  ///
  /// @throws IllegalStateException if the fields can never match (e.g. `0 0 31 2 *`)
  public ZonedDateTime nextFireTime(ZonedDateTime after) {
    var time = after.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
    final var limit = time.plusYears(SEARCH_YEARS);
    while (time.isBefore(limit)) {
      if (!months.get(time.getMonthValue())) {
        time = time.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
      } else if (!dayMatches(time)) {
        time = time.truncatedTo(ChronoUnit.DAYS).plusDays(1);
      } else if (!hours.get(time.getHour())) {
        time = time.truncatedTo(ChronoUnit.HOURS).plusHours(1);
      } else if (!minutes.get(time.getMinute())) {
        time = time.plusMinutes(1);
      } else {
        final var candidate = time.atZone(after.getZone());
        if (candidate.isAfter(after)) {
          return candidate;
        }
        // a daylight saving overlap mapped the local time back onto an earlier instant
        time = time.plusMinutes(1);
      }
    }
    throw new IllegalStateException("Schedule '" + expression + "' never fires");
  }

  private boolean dayMatches(LocalDateTime time) {
    final boolean dom = daysOfMonth.get(time.getDayOfMonth());
    final boolean dow = daysOfWeek.get(time.getDayOfWeek().getValue() % 7);
    if (daysOfMonthRestricted && daysOfWeekRestricted) {
      return dom || dow;
    }
    return dom && dow;
  }

  private static BitSet parseField(String field, int min, int max, String name) {
    final var bits = new BitSet(max + 1);
    for (String part : field.split(",")) {
      if (part.isEmpty()) {
        throw invalid(field, name);
      }
      int step = 1;
      var range = part;
      final int slash = part.indexOf('/');
      if (slash >= 0) {
        step = parseNumber(part.substring(slash + 1), field, name);
        range = part.substring(0, slash);
        if (step < 1) {
          throw invalid(field, name);
        }
      }
      final int from;
      final int to;
      if (range.equals("*")) {
        from = min;
        to = max;
      } else {
        final int dash = range.indexOf('-');
        if (dash > 0) {
          from = parseNumber(range.substring(0, dash), field, name);
          to = parseNumber(range.substring(dash + 1), field, name);
        } else {
          from = parseNumber(range, field, name);
          to = slash >= 0 ? max : from;
        }
      }
      if (from < min || to > max || from > to) {
        throw invalid(field, name);
      }
      for (int value = from; value <= to; value += step) {
        bits.set(value);
      }
    }
    return bits;
  }

  private static int parseNumber(String text, String field, String name) {
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw invalid(field, name);
    }
  }

  private static IllegalArgumentException invalid(String field, String name) {
    return new IllegalArgumentException(
        String.format("Invalid %s field '%s' in schedule expression", name, field));
  }

  @Override
  public String toString() {
    return "CronSchedule[" + expression + "]";
  }
}
