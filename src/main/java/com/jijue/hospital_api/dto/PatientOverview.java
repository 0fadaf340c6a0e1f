package com.jijue.hospital_api.dto;

import java.util.List;

/**
 * Dashboard counters. {@code currentBalance} stays 0 until billing exists.
 */
public record PatientOverview(
        long upcomingAppointments,
        long pendingResults,
        long activePrescriptions,
        double currentBalance,
        List<AppointmentActivity> recentAppointments) {
}
