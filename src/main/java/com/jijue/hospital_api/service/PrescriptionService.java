package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.PrescriptionRequest;
import com.jijue.hospital_api.dto.PrescriptionStatusUpdate;
import com.jijue.hospital_api.dto.RefillRequest;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.Prescription;
import com.jijue.hospital_api.model.PrescriptionStatus;
import com.jijue.hospital_api.repository.PrescriptionRepository;

@Service
public class PrescriptionService {

    private static final Logger logger = LoggerFactory.getLogger(PrescriptionService.class);

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final PrescriptionRepository prescriptionRepository;
    private final Clock clock;

    public PrescriptionService(PrescriptionRepository prescriptionRepository, Clock clock) {
        this.prescriptionRepository = prescriptionRepository;
        this.clock = clock;
    }

    public List<Prescription> getPrescriptions(String patientId, String status) {
        boolean byPatient = patientId != null && !patientId.isBlank();
        if (status == null || status.isBlank()) {
            return byPatient ? prescriptionRepository.findByPatientId(patientId, NEWEST_FIRST)
                    : prescriptionRepository.findAll(NEWEST_FIRST);
        }
        PrescriptionStatus parsed = PrescriptionStatus.fromValue(status);
        return byPatient ? prescriptionRepository.findByPatientIdAndStatus(patientId, parsed, NEWEST_FIRST)
                : prescriptionRepository.findByStatus(parsed, NEWEST_FIRST);
    }

    public Prescription requestPrescription(Patient patient, PrescriptionRequest request) {
        if (request == null || UserService.isBlank(request.medication())) {
            throw new IllegalArgumentException("Medication name is required");
        }
        Instant now = clock.instant();
        Prescription prescription = new Prescription(patient.getPatientId(), request.medication().trim(), PrescriptionStatus.REQUESTED);
        prescription.setPatient(patient.getId());
        prescription.setReason(request.reason());
        prescription.setDosage(request.dosage());
        prescription.setInstructions(request.instructions());
        prescription.setRequestedDate(now);
        prescription.setCreatedAt(now);
        prescription.setUpdatedAt(now);
        Prescription saved = prescriptionRepository.save(prescription);
        logger.info("Prescription of {} requested by patient {}", saved.getMedication(), patient.getPatientId());
        return saved;
    }

    /**
     * Refill of an active prescription, located by id or else by medication name.
     */
    public Prescription requestRefill(String patientId, RefillRequest request) {
        if (request == null || (UserService.isBlank(request.prescriptionId()) && UserService.isBlank(request.medication()))) {
            throw new IllegalArgumentException("Prescription ID or medication name is required");
        }
        Prescription prescription = (!UserService.isBlank(request.prescriptionId())
                ? prescriptionRepository.findByIdAndPatientIdAndStatus(request.prescriptionId(), patientId, PrescriptionStatus.ACTIVE)
                : prescriptionRepository.findFirstByPatientIdAndMedicationIgnoreCaseAndStatus(
                        patientId, request.medication().trim(), PrescriptionStatus.ACTIVE))
                .orElseThrow(() -> new NoSuchElementException("Active prescription not found"));

        if (prescription.getRefillsRemaining() <= 0) {
            logger.warn("Refill of {} for patient {} refused: none remaining", prescription.getMedication(), patientId);
            throw new IllegalArgumentException("No refills remaining for this prescription");
        }
        Instant now = clock.instant();
        prescription.setRefillsRemaining(prescription.getRefillsRemaining() - 1);
        prescription.setLastRefillDate(now);
        prescription.setStatus(PrescriptionStatus.REFILL_REQUESTED);
        prescription.setUpdatedAt(now);
        logger.info("Refill of {} requested by patient {} ({} left)", prescription.getMedication(), patientId,
                prescription.getRefillsRemaining());
        return prescriptionRepository.save(prescription);
    }

    public Prescription updateStatus(String id, PrescriptionStatusUpdate update) {
        if (update == null || UserService.isBlank(update.status())) {
            throw new IllegalArgumentException("Status is required");
        }
        PrescriptionStatus status = PrescriptionStatus.fromValue(update.status());
        Prescription prescription = prescriptionRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Prescription not found"));
        Instant now = clock.instant();
        if (status == PrescriptionStatus.ACTIVE && prescription.getStatus() != PrescriptionStatus.ACTIVE) {
            prescription.setPrescribedDate(now);
        }
        prescription.setStatus(status);
        if (update.refillsRemaining() != null) {
            if (update.refillsRemaining() < 0) {
                throw new IllegalArgumentException("Refills remaining cannot be negative");
            }
            prescription.setRefillsRemaining(update.refillsRemaining());
        }
        if (update.dosage() != null) prescription.setDosage(update.dosage());
        if (update.frequency() != null) prescription.setFrequency(update.frequency());
        prescription.setUpdatedAt(now);
        logger.info("Prescription {} set to {}", id, status.getValue());
        return prescriptionRepository.save(prescription);
    }

    public long countActive(String patientId) {
        return prescriptionRepository.countByPatientIdAndStatus(patientId, PrescriptionStatus.ACTIVE);
    }
}
