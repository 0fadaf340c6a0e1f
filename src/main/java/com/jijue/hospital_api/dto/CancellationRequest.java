package com.jijue.hospital_api.dto;

public record CancellationRequest(String reason, String cancelledBy) {
}
