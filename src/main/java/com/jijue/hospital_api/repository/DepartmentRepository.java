package com.jijue.hospital_api.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.Department;

@Repository
public interface DepartmentRepository extends MongoRepository<Department, String> {
    Optional<Department> findByNameIgnoreCase(String name);
    Optional<Department> findByDepartmentCode(String departmentCode);
}
