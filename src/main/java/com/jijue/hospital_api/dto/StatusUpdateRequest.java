package com.jijue.hospital_api.dto;

public record StatusUpdateRequest(String status, String notes) {
}
