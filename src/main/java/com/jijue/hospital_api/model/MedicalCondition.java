package com.jijue.hospital_api.model;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MedicalCondition {
    private String condition;
    private LocalDate diagnosedDate;
    private ConditionStatus status = ConditionStatus.ACTIVE;
    private String notes;
}
