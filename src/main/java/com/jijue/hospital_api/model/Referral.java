package com.jijue.hospital_api.model;

import java.time.LocalDate;

import lombok.Data;

@Data
public class Referral {
    private String toDepartment;
    private String reason;
    private LocalDate date;
}
