package com.jijue.hospital_api.dto;

import java.time.LocalDate;

public record RescheduleRequest(LocalDate newDate, String newTime, String reason) {
}
