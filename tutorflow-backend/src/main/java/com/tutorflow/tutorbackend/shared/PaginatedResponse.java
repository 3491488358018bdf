package com.tutorflow.tutorbackend.shared;

import org.springframework.data.domain.Page;

import java.util.List;

public class PaginatedResponse<T> {

    private final List<T> items;
    private final long totalItems;
    private final int page;
    private final int limit;

    public PaginatedResponse(List<T> items, long totalItems, int page, int limit) {
        this.items = items;
        this.totalItems = totalItems;
        this.page = page;
        this.limit = limit;
    }

    public static <T> PaginatedResponse<T> of(Page<T> page) {
        return new PaginatedResponse<>(page.getContent(), page.getTotalElements(), page.getNumber(), page.getSize());
    }

    public List<T> getItems() {
        return items;
    }

    public long getTotalItems() {
        return totalItems;
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }

    public int getTotalPages() {
        return limit == 0 ? 0 : (int) Math.ceil((double) totalItems / limit);
    }
}
