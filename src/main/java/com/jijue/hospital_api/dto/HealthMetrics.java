package com.jijue.hospital_api.dto;

public record HealthMetrics(String bloodPressure, String heartRate, String temperature, String bmi) {
}
