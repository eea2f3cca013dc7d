package com.digitalgroup.reportscheduler.api.v1.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Pagination wrapper: {@code data} plus 1-based {@code meta}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PagedResponse<T> {

    private List<T> data;
    private Meta meta;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        private long totalItems;
        private int page;
        private int pageSize;
        private int totalPages;
    }

    /**
     * Create a PagedResponse from a Spring Data page, mapping each element
     */
    public static <E, T> PagedResponse<T> fromPage(Page<E> page, Function<E, T> mapper) {
        return PagedResponse.<T>builder()
                .data(page.getContent().stream().map(mapper).toList())
                .meta(Meta.builder()
                        .totalItems(page.getTotalElements())
                        .page(page.getNumber() + 1) // Convert 0-based to 1-based
                        .pageSize(page.getSize())
                        .totalPages(page.getTotalPages())
                        .build())
                .build();
    }
}
