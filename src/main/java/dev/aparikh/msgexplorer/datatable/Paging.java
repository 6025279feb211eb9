package dev.aparikh.msgexplorer.datatable;

import java.util.List;

/**
 * 1-indexed page window over table cells.
 */
public record Paging(
        int page,
        int pageSize
) {
    public Paging {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
    }

    /**
     * Applies defaults for absent values and floors present ones to 1.
     */
    public static Paging of(Integer page, Integer pageSize, int defaultPageSize) {
        int normalizedPage = page == null ? 1 : Math.max(1, page);
        int normalizedSize = pageSize == null ? defaultPageSize : Math.max(1, pageSize);
        return new Paging(normalizedPage, normalizedSize);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public <T> List<T> slice(List<T> items) {
        int from = (int) Math.min(offset(), items.size());
        int to = (int) Math.min((long) from + pageSize, items.size());
        return items.subList(from, to);
    }
}
