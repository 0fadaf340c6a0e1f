package com.jijue.hospital_api.model;

public record AvailabilityCheck(boolean available, String reason) {

    public static AvailabilityCheck open() {
        return new AvailabilityCheck(true, null);
    }

    public static AvailabilityCheck closed(String reason) {
        return new AvailabilityCheck(false, reason);
    }
}
