package com.jijue.hospital_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentContact {
    private String phone;
    private String email;
    private String location;
    private String floor;
}
