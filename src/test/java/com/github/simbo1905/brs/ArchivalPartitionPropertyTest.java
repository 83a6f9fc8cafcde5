package com.github.simbo1905.brs;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/// After a sweep every archived row is older than the cutoff, every live row is not, and no row
/// is lost or duplicated.
class ArchivalPartitionPropertyTest {

  @Property(tries = 25)
  void sweepPartitionsRowsAtTheCutoff(
      @ForAll @Size(max = 12) List<@IntRange(min = -500, max = 30) Integer> bookingOffsets,
      @ForAll @IntRange(min = 0, max = 14) int months)
      throws IOException {
    final var dataDirectory = Files.createTempDirectory("archival-partition");
    try {
      final var config =
          TestStores.builder(
                  dataDirectory, new MutableClock(TestStores.START, TestStores.ZONE))
              .maxBookingsPerDay(1000)
              .build();
      final var fixture = TestStores.fixture(config, NioStoreFileOperations.INSTANCE);
      final Set<String> before = new HashSet<>();
      for (int offset : bookingOffsets) {
        before.add(
            fixture.store.add(TestStores.payload(TestStores.TODAY.plusDays(offset), "Guest " + offset)).id());
      }

      final var result = new Archiver(fixture.store, fixture.backups).archiveOlderThan(months);

      final var cutoff = TestStores.TODAY.minusMonths(months);
      assertEquals(cutoff, result.cutoffDate());
      final var live = fixture.store.list();
      for (SubmissionRecord record : live) {
        assertFalse(record.bookingDate().isBefore(cutoff));
      }
      final Set<String> after =
          live.stream().map(SubmissionRecord::id).collect(Collectors.toCollection(HashSet::new));
      if (result.archivedCount() > 0) {
        final var sheet =
            WorkbookCodec.decode(Files.readAllBytes(result.archiveFile().orElseThrow()))
                .sheet(SubmissionSheets.ARCHIVE);
        for (int row = 0; row < sheet.rowCount(); row++) {
          final var record = SubmissionSheets.fromRow(sheet, row);
          assertTrue(record.bookingDate().isBefore(cutoff));
          assertTrue("duplicate " + record.id(), after.add(record.id()));
        }
      } else {
        assertTrue(result.archiveFile().isEmpty());
      }
      assertEquals(before, after);
      assertEquals(live.size(), fixture.store.summaryTotal());
    } finally {
      TestStores.deleteRecursively(dataDirectory);
    }
  }
}
