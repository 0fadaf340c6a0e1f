package com.jijue.hospital_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionItem {
    private String medication;
    private String dosage;
    private String frequency;
    private String duration;
    private String instructions;
}
