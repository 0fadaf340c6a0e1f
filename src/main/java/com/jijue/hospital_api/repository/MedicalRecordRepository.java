package com.jijue.hospital_api.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.MedicalRecord;

@Repository
public interface MedicalRecordRepository extends MongoRepository<MedicalRecord, String> {
    List<MedicalRecord> findByPatientIdOrderByVisitDateDesc(String patientId);
    Optional<MedicalRecord> findFirstByPatientIdOrderByVisitDateDesc(String patientId);
}
