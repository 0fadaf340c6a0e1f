package com.jijue.hospital_api.model;

import java.time.LocalDate;

import lombok.Data;

@Data
public class FollowUp {
    private boolean required;
    private LocalDate date;
    private String notes;
}
