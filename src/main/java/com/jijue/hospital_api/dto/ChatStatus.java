package com.jijue.hospital_api.dto;

public record ChatStatus(boolean chatAvailable, String message, String businessHours) {
}
