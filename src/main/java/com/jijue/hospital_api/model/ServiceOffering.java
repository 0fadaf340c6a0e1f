package com.jijue.hospital_api.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A service listed on a department page (distinct from the hospital-wide catalog). */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceOffering {
    private String name;
    private String description;
    private Double price;
    private String duration;
    private List<String> requirements = new ArrayList<>();
}
