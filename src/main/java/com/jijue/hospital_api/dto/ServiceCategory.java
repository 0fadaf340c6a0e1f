package com.jijue.hospital_api.dto;

public record ServiceCategory(String value, String name) {
}
