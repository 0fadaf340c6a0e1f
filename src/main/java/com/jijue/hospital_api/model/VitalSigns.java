package com.jijue.hospital_api.model;

import lombok.Data;

/** Weight in kilograms, height in centimetres. */
@Data
public class VitalSigns {
    private String bloodPressure;
    private Integer heartRate;
    private Double temperature;
    private Double weight;
    private Double height;
    private Integer oxygenSaturation;
    private Double bmi;

    public void recomputeBmi() {
        if (weight != null && height != null && height > 0) {
            double meters = height / 100.0;
            bmi = Math.round(weight / (meters * meters) * 10) / 10.0;
        }
    }
}
