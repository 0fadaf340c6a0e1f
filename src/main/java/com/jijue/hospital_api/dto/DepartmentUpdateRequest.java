package com.jijue.hospital_api.dto;

import java.util.List;

import com.jijue.hospital_api.model.Capacity;
import com.jijue.hospital_api.model.DepartmentContact;
import com.jijue.hospital_api.model.OperatingHours;
import com.jijue.hospital_api.model.ServiceOffering;

/**
 * Partial department update. Null means "leave as is".
 */
public record DepartmentUpdateRequest(
        String name,
        String description,
        String icon,
        String headOfDepartment,
        DepartmentContact contact,
        List<ServiceOffering> services,
        OperatingHours operatingHours,
        String status,
        Boolean isActive,
        String departmentCode,
        String floor,
        String wing,
        Capacity capacity,
        List<String> equipment,
        List<String> specializations,
        String colorCode) {
}
