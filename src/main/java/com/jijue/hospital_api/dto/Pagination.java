package com.jijue.hospital_api.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public record Pagination(int currentPage, int totalPages, long totalItems, int limit, boolean hasNext, boolean hasPrev) {

    public static Pagination of(int page, int limit, long total) {
        int totalPages = (int) Math.ceil(total / (double) limit);
        return new Pagination(page, totalPages, total, limit, page < totalPages, page > 1);
    }

    /** Response form, with the total named after the listed resource (e.g. {@code totalDoctors}). */
    public Map<String, Object> describe(String totalKey) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("currentPage", currentPage);
        body.put("totalPages", totalPages);
        body.put(totalKey, totalItems);
        body.put("limit", limit);
        body.put("hasNext", hasNext);
        body.put("hasPrev", hasPrev);
        return body;
    }
}
