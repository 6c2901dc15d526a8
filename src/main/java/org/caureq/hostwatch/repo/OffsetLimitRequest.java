package org.caureq.hostwatch.repo;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * {@link Pageable} addressed by row offset instead of page number, for offset/limit query params.
 * The page number is derived and only meaningful when the offset is a multiple of the limit.
 */
public final class OffsetLimitRequest implements Pageable {
    private final long offset;
    private final int limit;
    private final Sort sort;

    public OffsetLimitRequest(long offset, int limit, Sort sort) {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
        this.offset = offset;
        this.limit = limit;
        this.sort = sort == null ? Sort.unsorted() : sort;
    }

    @Override public int getPageNumber() { return (int) (offset / limit); }
    @Override public int getPageSize() { return limit; }
    @Override public long getOffset() { return offset; }
    @Override public Sort getSort() { return sort; }

    @Override
    public Pageable next() {
        return new OffsetLimitRequest(offset + limit, limit, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetLimitRequest(Math.max(0, offset - limit), limit, sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetLimitRequest(0, limit, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetLimitRequest((long) pageNumber * limit, limit, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OffsetLimitRequest other)) return false;
        return offset == other.offset && limit == other.limit && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Long.hashCode(offset) + limit) + sort.hashCode();
    }

    @Override
    public String toString() {
        return "OffsetLimitRequest[offset=" + offset + ", limit=" + limit + ", sort=" + sort + "]";
    }
}
