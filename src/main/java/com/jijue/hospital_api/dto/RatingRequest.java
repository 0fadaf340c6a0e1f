package com.jijue.hospital_api.dto;

public record RatingRequest(Integer rating) {
}
