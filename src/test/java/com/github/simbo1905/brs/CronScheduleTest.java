package com.github.simbo1905.brs;

import static org.junit.Assert.*;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.junit.Test;

public class CronScheduleTest {

  private static ZonedDateTime at(String text) {
    return ZonedDateTime.parse(text);
  }

  private static String next(String interval, String after) {
    return CronSchedule.parse(interval).nextFireTime(at(after)).toString();
  }

  @Test
  public void testNamedIntervals() {
    assertEquals(CronSchedule.HOURLY, CronSchedule.parse("hourly").expression());
    assertEquals(CronSchedule.DAILY, CronSchedule.parse(" DAILY ").expression());
    assertEquals(CronSchedule.WEEKLY, CronSchedule.parse("Weekly").expression());
  }

  @Test
  public void testHourly() {
    assertEquals("2025-03-15T11:00Z", next("hourly", "2025-03-15T10:00Z"));
    assertEquals("2025-03-15T11:00Z", next("hourly", "2025-03-15T10:30:15Z"));
  }

  @Test
  public void testDailyIsStrictlyAfter() {
    assertEquals("2025-03-15T02:00Z", next("daily", "2025-03-15T01:59:59Z"));
    assertEquals("2025-03-16T02:00Z", next("daily", "2025-03-15T02:00Z"));
  }

  @Test
  public void testWeeklyRunsSundayMorning() {
    // 2025-03-15 is a Saturday
    assertEquals("2025-03-16T02:00Z", next("weekly", "2025-03-15T10:00Z"));
    assertEquals("2025-03-23T02:00Z", next("weekly", "2025-03-16T02:00Z"));
    assertEquals("2025-03-16T02:00Z", next("0 2 * * 7", "2025-03-15T10:00Z"));
  }

  @Test
  public void testStepsRangesAndLists() {
    final var workHours = "*/15 9-17 * * 1-5";
    // Friday evening rolls over the weekend
    assertEquals("2025-03-17T09:00Z", next(workHours, "2025-03-14T17:50Z"));
    assertEquals("2025-03-17T09:15Z", next(workHours, "2025-03-17T09:00Z"));
    assertEquals("2025-03-15T10:40Z", next("10,40 * * * *", "2025-03-15T10:10Z"));
    assertEquals("2025-03-15T12:00Z", next("0 0-23/6 * * *", "2025-03-15T10:00Z"));
    assertEquals("2025-03-15T10:35Z", next("5/30 * * * *", "2025-03-15T10:06Z"));
  }

  @Test
  public void testEitherDayFieldMatches() {
    // the 13th or any Friday
    assertEquals("2025-03-21T00:00Z", next("0 0 13 * 5", "2025-03-15T10:00Z"));
    // only the month restricted
    assertEquals("2025-06-01T00:00Z", next("0 0 1 6 *", "2025-03-15T10:00Z"));
  }

  @Test
  public void testKeepsTheCallersZone() {
    final var kolkata = ZonedDateTime.parse("2025-03-15T10:00Z").withZoneSameInstant(ZoneId.of("Asia/Kolkata"));
    final var fire = CronSchedule.parse("daily").nextFireTime(kolkata);
    assertEquals(ZoneId.of("Asia/Kolkata"), fire.getZone());
    assertEquals("2025-03-16T02:00+05:30[Asia/Kolkata]", fire.toString());
  }

  @Test
  public void testMalformedExpressionsAreRejected() {
    for (String bad :
        new String[] {
          "", "* * * *", "* * * * * *", "60 * * * *", "* 24 * * *", "* * 0 * *", "* * * 13 *",
          "* * * * 8", "a * * * *", "*/0 * * * *", "5-1 * * * *", "1,,2 * * * *", "fortnightly"
        }) {
      assertThrows(bad, IllegalArgumentException.class, () -> CronSchedule.parse(bad));
    }
  }

  @Test
  public void testImpossibleDateNeverFires() {
    final var schedule = CronSchedule.parse("0 0 31 2 *");
    assertThrows(IllegalStateException.class, () -> schedule.nextFireTime(at("2025-03-15T10:00Z")));
  }
}
