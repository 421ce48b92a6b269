package io.intellixity.sqlgate.transform;

import io.intellixity.sqlgate.error.InvalidPaginationException;

/** Row window applied to the top-level query: {@code limit} rows starting after {@code offset}. */
public record PaginationWindow(long limit, long offset) {
  public PaginationWindow {
    if (limit < 0) throw new InvalidPaginationException("Limit must be non-negative");
    if (offset < 0) throw new InvalidPaginationException("Offset must be non-negative");
  }

  public static PaginationWindow of(long limit) {
    return new PaginationWindow(limit, 0);
  }

  /** Window for a 1-based page number. */
  public static PaginationWindow forPage(int page, int limit) {
    return new PaginationWindow(limit, (long) (page - 1) * limit);
  }
}
