package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.error.InvalidPaginationException;

/** Caller-supplied page arguments, checked and clamped to the configured row ceiling. */
record Paging(int limit, int page) {

  static Paging of(int limit, int page, int maxRows) {
    if (limit < 1) throw new InvalidPaginationException("Limit must be greater than 0");
    if (page < 1) throw new InvalidPaginationException("Page number must be greater than 0");
    return new Paging(Math.min(limit, maxRows), page);
  }

  long offset() {
    return (long) (page - 1) * limit;
  }

  static long totalPages(long total, int limit) {
    return total > 0 ? (total + limit - 1) / limit : 1;
  }
}
