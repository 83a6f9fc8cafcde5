package com.github.simbo1905.brs;

/// A sheet column: the header text shown in row one, the field key it carries and a display width.
public record Column(String header, String key, int width) {}
