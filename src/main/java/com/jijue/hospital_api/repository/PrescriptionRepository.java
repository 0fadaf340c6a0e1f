package com.jijue.hospital_api.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.Prescription;
import com.jijue.hospital_api.model.PrescriptionStatus;

@Repository
public interface PrescriptionRepository extends MongoRepository<Prescription, String> {
    List<Prescription> findByPatientId(String patientId, Sort sort);
    List<Prescription> findByStatus(PrescriptionStatus status, Sort sort);
    List<Prescription> findByPatientIdAndStatus(String patientId, PrescriptionStatus status, Sort sort);
    long countByPatientIdAndStatus(String patientId, PrescriptionStatus status);
    Optional<Prescription> findByIdAndPatientIdAndStatus(String id, String patientId, PrescriptionStatus status);
    Optional<Prescription> findFirstByPatientIdAndMedicationIgnoreCaseAndStatus(String patientId, String medication, PrescriptionStatus status);
}
