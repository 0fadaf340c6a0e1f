package com.jijue.hospital_api.dto;

/**
 * Query-string filters of the doctor directory.
 */
public record DoctorSearchCriteria(
        String specialization,
        String department,
        String search,
        Integer experience,
        Double rating,
        String language,
        Boolean available,
        Boolean verified,
        int page,
        int limit,
        String sortBy,
        String sortOrder) {
}
