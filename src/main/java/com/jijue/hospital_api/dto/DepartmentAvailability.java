package com.jijue.hospital_api.dto;

import com.jijue.hospital_api.model.OperatingHours;

public record DepartmentAvailability(
        boolean isOpen,
        String currentStatus,
        OperatingHours operatingHours,
        String formattedHours,
        boolean emergency) {
}
