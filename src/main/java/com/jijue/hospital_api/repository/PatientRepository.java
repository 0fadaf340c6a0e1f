package com.jijue.hospital_api.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.Patient;

@Repository
public interface PatientRepository extends MongoRepository<Patient, String> {
    Optional<Patient> findByPatientId(String patientId);
    Optional<Patient> findByEmail(String email);
    Optional<Patient> findByEmailAndIdNumber(String email, String idNumber);
    boolean existsByEmail(String email);
    boolean existsByIdNumber(String idNumber);
}
