package com.jijue.hospital_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Allergy {
    private String allergen;
    private AllergySeverity severity = AllergySeverity.MODERATE;
    private String reaction;
}
