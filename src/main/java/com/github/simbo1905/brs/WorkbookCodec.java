package com.github.simbo1905.brs;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.CRC32;

/// Binary encoding of a [Workbook].
///
/// Layout, all integers big-endian:
/// <pre>
/// magic(8) version(4) sheetCount(4)
///   per sheet: name columnCount(4) {header key width(4)} bold(1) fill rowCount(4)
///     per row: cellCount(4) {present(1) [text]}
/// crc32(8) over every preceding byte
/// </pre>
/// Text is a length-prefixed (4 byte) UTF-8 string so cells are not limited to 64 KiB.
final class WorkbookCodec {

  private static final Logger logger = Logger.getLogger(WorkbookCodec.class.getName());

  /// ASCII "VRTWBBK1", stamped at the start of every workbook file.
  static final long MAGIC_NUMBER = 0x5652545742424B31L;

  static final int FORMAT_VERSION = 1;

  /// Upper bound on any length prefix; guards against reading garbage as a huge allocation.
  private static final int MAX_LENGTH = 64 * 1024 * 1024;

  private static final int CRC_LENGTH = Long.BYTES;

  private WorkbookCodec() {}

  static byte[] encode(Workbook workbook) {
    final var bytes = new ByteArrayOutputStream(8 * 1024);
    try (var out = new DataOutputStream(bytes)) {
      out.writeLong(MAGIC_NUMBER);
      out.writeInt(FORMAT_VERSION);
      out.writeInt(workbook.sheets().size());
      for (Sheet sheet : workbook.sheets()) {
        writeText(out, sheet.name());
        out.writeInt(sheet.columns().size());
        for (Column column : sheet.columns()) {
          writeText(out, column.header());
          writeText(out, column.key());
          out.writeInt(column.width());
        }
        out.writeBoolean(sheet.headerStyle().bold());
        writeText(out, sheet.headerStyle().fillArgb());
        out.writeInt(sheet.rowCount());
        for (List<String> row : sheet.rows()) {
          out.writeInt(row.size());
          for (String cell : row) {
            out.writeBoolean(cell != null);
            if (cell != null) {
              writeText(out, cell);
            }
          }
        }
      }
      final var crc32 = new CRC32();
      final var body = bytes.toByteArray();
      crc32.update(body, 0, body.length);
      out.writeLong(crc32.getValue());
    } catch (IOException e) {
      // a ByteArrayOutputStream never throws
      throw new IllegalStateException(e);
    }
    return bytes.toByteArray();
  }

  /// @throws StoreIOException if the bytes are not a complete, uncorrupted workbook
  static Workbook decode(byte[] data) throws StoreIOException {
    if (data.length < Long.BYTES + Integer.BYTES + Integer.BYTES + CRC_LENGTH) {
      throw new StoreIOException("Workbook is truncated: " + data.length + " bytes");
    }
    final int bodyLength = data.length - CRC_LENGTH;
    final var crc32 = new CRC32();
    crc32.update(data, 0, bodyLength);
    final long actualCrc = crc32.getValue();
    try (var in = new DataInputStream(new ByteArrayInputStream(data))) {
      final long magic = in.readLong();
      if (magic != MAGIC_NUMBER) {
        throw new StoreIOException(
            String.format("Not a workbook file, magic number was 0x%016X", magic));
      }
      final int version = in.readInt();
      if (version != FORMAT_VERSION) {
        throw new StoreIOException("Unsupported workbook version " + version);
      }
      final var stored = new DataInputStream(new ByteArrayInputStream(data, bodyLength, CRC_LENGTH));
      final long expectedCrc = stored.readLong();
      if (expectedCrc != actualCrc) {
        throw new StoreIOException(
            String.format(
                "CRC32 check failed expected %d got %d for workbook length %d",
                expectedCrc, actualCrc, data.length));
      }
      final var workbook = new Workbook();
      final int sheetCount = readLength(in);
      for (int s = 0; s < sheetCount; s++) {
        final var name = readText(in);
        final int columnCount = readLength(in);
        final var columns = new ArrayList<Column>(columnCount);
        for (int c = 0; c < columnCount; c++) {
          columns.add(new Column(readText(in), readText(in), in.readInt()));
        }
        final var style = new HeaderStyle(in.readBoolean(), readText(in));
        final var sheet = workbook.addSheet(new Sheet(name, columns, style));
        final int rowCount = readLength(in);
        for (int r = 0; r < rowCount; r++) {
          final int cellCount = readLength(in);
          final var cells = new ArrayList<String>(cellCount);
          for (int c = 0; c < cellCount; c++) {
            cells.add(in.readBoolean() ? readText(in) : null);
          }
          sheet.addRow(cells);
        }
      }
      logger.log(
          Level.FINEST,
          () -> String.format("decoded %d bytes into %s", data.length, workbook));
      return workbook;
    } catch (EOFException e) {
      throw new StoreIOException("Workbook is truncated", e);
    } catch (StoreIOException e) {
      throw e;
    } catch (IOException | IllegalArgumentException e) {
      throw new StoreIOException("Workbook is corrupt: " + e.getMessage(), e);
    }
  }

  private static void writeText(DataOutputStream out, String text) throws IOException {
    final var utf8 = text.getBytes(StandardCharsets.UTF_8);
    out.writeInt(utf8.length);
    out.write(utf8);
  }

  private static String readText(DataInputStream in) throws IOException {
    final var utf8 = new byte[readLength(in)];
    in.readFully(utf8);
    return new String(utf8, StandardCharsets.UTF_8);
  }

  private static int readLength(DataInputStream in) throws IOException {
    final int length = in.readInt();
    if (length < 0 || length > MAX_LENGTH) {
      throw new IOException("Invalid length " + length);
    }
    return length;
  }
}
