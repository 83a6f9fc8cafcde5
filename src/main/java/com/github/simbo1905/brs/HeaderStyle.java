package com.github.simbo1905.brs;

/// Presentation of a sheet's header row.
///
/// @param fillArgb background colour as ARGB hex, or empty for no fill
public record HeaderStyle(boolean bold, String fillArgb) {

  public static final HeaderStyle BOLD = new HeaderStyle(true, "");
  public static final HeaderStyle BOLD_GREY = new HeaderStyle(true, "FFE0E0E0");
}
