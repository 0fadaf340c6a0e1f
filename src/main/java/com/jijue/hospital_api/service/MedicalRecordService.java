package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.model.MedicalRecord;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.repository.MedicalRecordRepository;

@Service
public class MedicalRecordService {

    private static final Logger logger = LoggerFactory.getLogger(MedicalRecordService.class);

    private final MedicalRecordRepository medicalRecordRepository;
    private final Clock clock;

    public MedicalRecordService(MedicalRecordRepository medicalRecordRepository, Clock clock) {
        this.medicalRecordRepository = medicalRecordRepository;
        this.clock = clock;
    }

    public List<MedicalRecord> getRecords(String patientId) {
        return medicalRecordRepository.findByPatientIdOrderByVisitDateDesc(patientId);
    }

    public Optional<MedicalRecord> getLatestRecord(String patientId) {
        return medicalRecordRepository.findFirstByPatientIdOrderByVisitDateDesc(patientId);
    }

    /**
     * @param doctorId database id of the recording doctor, {@code null} when an administrator records the visit
     */
    public MedicalRecord addRecord(Patient patient, MedicalRecord record, String doctorId) {
        if (record == null || UserService.isBlank(record.getDiagnosis())) {
            throw new IllegalArgumentException("Diagnosis is required");
        }
        record.setId(null);
        record.setPatient(patient.getId());
        record.setPatientId(patient.getPatientId());
        if (record.getDoctor() == null) {
            record.setDoctor(doctorId);
        }
        if (record.getVisitDate() == null) {
            record.setVisitDate(LocalDate.now(clock));
        }
        if (record.getVitalSigns() != null) {
            record.getVitalSigns().recomputeBmi();
        }
        Instant now = clock.instant();
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        MedicalRecord saved = medicalRecordRepository.save(record);
        logger.info("Medical record added for patient {} (visit {})", patient.getPatientId(), saved.getVisitDate());
        return saved;
    }
}
