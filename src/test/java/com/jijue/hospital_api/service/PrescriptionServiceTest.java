package com.jijue.hospital_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.jijue.hospital_api.dto.PrescriptionRequest;
import com.jijue.hospital_api.dto.PrescriptionStatusUpdate;
import com.jijue.hospital_api.dto.RefillRequest;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.Prescription;
import com.jijue.hospital_api.model.PrescriptionStatus;
import com.jijue.hospital_api.repository.PrescriptionRepository;

@ExtendWith(MockitoExtension.class)
class PrescriptionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-10T05:00:00Z");

    @Mock
    private PrescriptionRepository prescriptionRepository;

    private PrescriptionService prescriptionService;

    @BeforeEach
    void setUp() {
        prescriptionService = new PrescriptionService(prescriptionRepository, Clock.fixed(NOW, ZoneId.of("Africa/Nairobi")));
    }

    @Test
    void requestStartsInRequestedState() {
        Patient patient = new Patient("Joy", "Atieno", null, "joy@jijue.test");
        patient.setId("p-1");
        patient.setPatientId("PAT100200300");
        when(prescriptionRepository.save(any(Prescription.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Prescription saved = prescriptionService.requestPrescription(patient,
                new PrescriptionRequest(" Metformin ", "Diabetes", "500mg", null));

        assertThat(saved.getMedication()).isEqualTo("Metformin");
        assertThat(saved.getStatus()).isEqualTo(PrescriptionStatus.REQUESTED);
        assertThat(saved.getPatientId()).isEqualTo("PAT100200300");
        assertThat(saved.getRequestedDate()).isEqualTo(NOW);
    }

    @Test
    void medicationIsRequired() {
        assertThatThrownBy(() -> prescriptionService.requestPrescription(new Patient(),
                new PrescriptionRequest(null, null, null, null)))
                .hasMessage("Medication name is required");
    }

    @Test
    void refillConsumesOneRemainingRefill() {
        Prescription active = new Prescription("PAT100200300", "Metformin", PrescriptionStatus.ACTIVE);
        active.setRefillsRemaining(2);
        when(prescriptionRepository.findFirstByPatientIdAndMedicationIgnoreCaseAndStatus(
                "PAT100200300", "metformin", PrescriptionStatus.ACTIVE)).thenReturn(Optional.of(active));
        when(prescriptionRepository.save(active)).thenReturn(active);

        Prescription refilled = prescriptionService.requestRefill("PAT100200300", new RefillRequest(null, "metformin"));

        assertThat(refilled.getRefillsRemaining()).isEqualTo(1);
        assertThat(refilled.getStatus()).isEqualTo(PrescriptionStatus.REFILL_REQUESTED);
        assertThat(refilled.getLastRefillDate()).isEqualTo(NOW);
    }

    @Test
    void refillWithNoneRemainingIsRefused() {
        Prescription active = new Prescription("PAT100200300", "Metformin", PrescriptionStatus.ACTIVE);
        when(prescriptionRepository.findByIdAndPatientIdAndStatus("rx-1", "PAT100200300", PrescriptionStatus.ACTIVE))
                .thenReturn(Optional.of(active));

        assertThatThrownBy(() -> prescriptionService.requestRefill("PAT100200300", new RefillRequest("rx-1", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No refills remaining for this prescription");
    }

    @Test
    void refillOfUnknownPrescriptionIsNotFound() {
        when(prescriptionRepository.findByIdAndPatientIdAndStatus("rx-9", "PAT100200300", PrescriptionStatus.ACTIVE))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> prescriptionService.requestRefill("PAT100200300", new RefillRequest("rx-9", null)))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void approvalStampsPrescribedDate() {
        Prescription requested = new Prescription("PAT100200300", "Metformin", PrescriptionStatus.REQUESTED);
        when(prescriptionRepository.findById("rx-1")).thenReturn(Optional.of(requested));
        when(prescriptionRepository.save(requested)).thenReturn(requested);

        Prescription approved = prescriptionService.updateStatus("rx-1",
                new PrescriptionStatusUpdate("active", 3, null, null));

        assertThat(approved.getStatus()).isEqualTo(PrescriptionStatus.ACTIVE);
        assertThat(approved.getPrescribedDate()).isEqualTo(NOW);
        assertThat(approved.getRefillsRemaining()).isEqualTo(3);
    }
}
