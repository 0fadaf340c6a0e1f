package com.jijue.hospital_api.dto;

public record AvailabilityToggleRequest(Boolean isAvailable) {
}
