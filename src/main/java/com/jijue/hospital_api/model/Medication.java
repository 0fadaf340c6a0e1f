package com.jijue.hospital_api.model;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Medication {
    private String name;
    private String dosage;
    private String frequency;
    private LocalDate prescribedDate;
    private String prescribingDoctor;
}
