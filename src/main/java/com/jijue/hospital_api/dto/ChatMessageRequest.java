package com.jijue.hospital_api.dto;

public record ChatMessageRequest(String message) {
}
