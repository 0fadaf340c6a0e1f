package com.jijue.hospital_api.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jijue.hospital_api.dto.DepartmentUpdateRequest;
import com.jijue.hospital_api.model.Department;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.ServiceOffering;
import com.jijue.hospital_api.service.DepartmentService;

@RestController
@RequestMapping("/api/departments")
public class DepartmentController {

    private final DepartmentService departmentService;

    public DepartmentController(DepartmentService departmentService) {
        this.departmentService = departmentService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getDepartments(@RequestParam(required = false) Boolean active,
                                                              @RequestParam(required = false) Boolean emergency,
                                                              @RequestParam(required = false) String floor) {
        List<Department> departments = departmentService.getDepartments(active, emergency, floor);
        return ResponseEntity.ok(Map.of("success", true, "count", departments.size(), "data", departments));
    }

    @GetMapping("/active")
    public ResponseEntity<Map<String, Object>> getActiveDepartments() {
        List<Department> departments = departmentService.getActiveDepartments();
        return ResponseEntity.ok(Map.of("success", true, "count", departments.size(), "data", departments));
    }

    @GetMapping("/emergency")
    public ResponseEntity<Map<String, Object>> getEmergencyDepartments() {
        List<Department> departments = departmentService.getEmergencyDepartments();
        return ResponseEntity.ok(Map.of("success", true, "count", departments.size(), "data", departments));
    }

    @GetMapping("/code/{code}")
    public ResponseEntity<Map<String, Object>> getByCode(@PathVariable String code) {
        return ResponseEntity.ok(Map.of("success", true, "data", departmentService.getByCode(code)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getDepartment(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("success", true, "data", departmentService.getDepartmentById(id)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> createDepartment(@RequestBody Department department) {
        Department saved = departmentService.createDepartment(department);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", "Department created successfully",
                "data", saved));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> updateDepartment(@PathVariable String id,
                                                                @RequestBody DepartmentUpdateRequest update) {
        Department updated = departmentService.updateDepartment(id, update);
        return ResponseEntity.ok(Map.of("success", true, "message", "Department updated successfully", "data", updated));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> deleteDepartment(@PathVariable String id) {
        departmentService.deactivateDepartment(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Department deactivated successfully"));
    }

    @GetMapping("/{id}/doctors")
    public ResponseEntity<Map<String, Object>> getDepartmentDoctors(@PathVariable String id,
                                                                    @RequestParam(required = false) Boolean available,
                                                                    @RequestParam(required = false) String specialization) {
        List<Doctor> doctors = departmentService.getDepartmentDoctors(id, available, specialization);
        return ResponseEntity.ok(Map.of("success", true, "count", doctors.size(), "data", doctors));
    }

    @PostMapping("/{id}/services")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> addService(@PathVariable String id,
                                                          @RequestBody ServiceOffering service) {
        Department updated = departmentService.addService(id, service);
        return ResponseEntity.ok(Map.of("success", true, "message", "Service added successfully", "data", updated));
    }

    @GetMapping("/{id}/availability")
    public ResponseEntity<Map<String, Object>> getAvailability(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("success", true, "data", departmentService.getAvailability(id)));
    }
}
