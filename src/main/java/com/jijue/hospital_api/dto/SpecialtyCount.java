package com.jijue.hospital_api.dto;

public record SpecialtyCount(String value, String label, long count) {
}
