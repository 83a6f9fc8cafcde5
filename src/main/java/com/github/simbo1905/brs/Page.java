package com.github.simbo1905.brs;

import java.util.List;

/// One page of an ordered result list. Pages are numbered from 1.
public record Page<T>(
    List<T> data, int total, int page, int limit, int pages, boolean hasNext, boolean hasPrev) {

  public static final int DEFAULT_LIMIT = 50;

  public static <T> Page<T> of(List<T> items, int page, int limit) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1, got " + page);
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1, got " + limit);
    }
    final int total = items.size();
    final long start = (long) (page - 1) * limit;
    final int from = (int) Math.min(start, total);
    final int to = (int) Math.min(start + limit, total);
    return new Page<>(
        List.copyOf(items.subList(from, to)),
        total,
        page,
        limit,
        total == 0 ? 0 : (total - 1) / limit + 1,
        start + limit < total,
        page > 1);
  }
}
