package com.jijue.hospital_api.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.DoctorStatus;

@Repository
public interface DoctorRepository extends MongoRepository<Doctor, String> {
    Optional<Doctor> findByDoctorId(String doctorId);
    boolean existsByLicenseNumber(String licenseNumber);
    boolean existsByEmail(String email);
    List<Doctor> findByStatus(DoctorStatus status);
    List<Doctor> findByStatusAndAvailableTrueAndVerifiedTrue(DoctorStatus status, Sort sort);
    List<Doctor> findByDepartmentAndStatus(String department, DoctorStatus status, Sort sort);
}
