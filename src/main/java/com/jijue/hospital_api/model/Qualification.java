package com.jijue.hospital_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Qualification {
    private String degree;
    private String institution;
    private Integer year;
    private String country;
}
