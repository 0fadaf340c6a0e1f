package com.jijue.hospital_api.model;

import lombok.Data;

@Data
public class DoctorPreferences {
    private int maxPatientsPerDay = 20;
    private boolean allowOnlineConsultation = true;
}
