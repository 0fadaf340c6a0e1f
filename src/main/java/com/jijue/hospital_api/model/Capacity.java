package com.jijue.hospital_api.model;

import lombok.Data;

@Data
public class Capacity {
    private int beds;
    private int staff;
}
