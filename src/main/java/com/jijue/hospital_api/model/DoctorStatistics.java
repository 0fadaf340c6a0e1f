package com.jijue.hospital_api.model;

import lombok.Data;

@Data
public class DoctorStatistics {
    private int totalPatients;
    private int totalAppointments;
    private int completedAppointments;
}
