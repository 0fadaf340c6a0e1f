package com.jijue.hospital_api.dto;

import java.util.Map;

public record DoctorStats(long totalDoctors, long availableDoctors, double averageRating, Map<String, Long> bySpecialization) {
}
