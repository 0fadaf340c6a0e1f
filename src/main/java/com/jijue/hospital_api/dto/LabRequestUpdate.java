package com.jijue.hospital_api.dto;

public record LabRequestUpdate(String status, String results) {
}
