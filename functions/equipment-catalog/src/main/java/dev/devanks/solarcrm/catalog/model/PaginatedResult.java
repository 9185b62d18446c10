package dev.devanks.solarcrm.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PaginatedResult<T> {
    List<T> items;
    long total;
    int page;
    int pageSize;
    int totalPages;

    public static <T> PaginatedResult<T> of(List<T> items, long total, int page, int pageSize) {
        int totalPages = pageSize == 0 ? 0 : (int) Math.ceil((double) total / pageSize);
        return PaginatedResult.<T>builder()
                .items(items)
                .total(total)
                .page(page)
                .pageSize(pageSize)
                .totalPages(totalPages)
                .build();
    }
}
