package com.jijue.hospital_api.dto;

import java.util.Map;

public record AppointmentStats(long total, long today, long upcoming, Map<String, Long> statusBreakdown) {
}
