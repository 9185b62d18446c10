package dev.devanks.solarcrm.catalog.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PaginationOptions {

    public static final int DEFAULT_PAGE_SIZE = 20;

    @Builder.Default
    int page = 1;
    @Builder.Default
    int pageSize = DEFAULT_PAGE_SIZE;
    @Builder.Default
    String sortField = "createdAt";
    @Builder.Default
    SortDirection sortDirection = SortDirection.DESC;

    public static PaginationOptions defaults() {
        return PaginationOptions.builder().build();
    }

    public static PaginationOptions page(int page, int pageSize) {
        return PaginationOptions.builder().page(page).pageSize(pageSize).build();
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
