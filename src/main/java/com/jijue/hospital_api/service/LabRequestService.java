package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.LabRequestUpdate;
import com.jijue.hospital_api.dto.LabWorkRequest;
import com.jijue.hospital_api.model.LabRequest;
import com.jijue.hospital_api.model.LabRequestStatus;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.Urgency;
import com.jijue.hospital_api.repository.LabRequestRepository;

@Service
public class LabRequestService {

    private static final Logger logger = LoggerFactory.getLogger(LabRequestService.class);

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "requestedDate");

    /** Requests whose results are still outstanding. */
    static final EnumSet<LabRequestStatus> PENDING =
            EnumSet.of(LabRequestStatus.REQUESTED, LabRequestStatus.SCHEDULED, LabRequestStatus.IN_PROGRESS);

    private final LabRequestRepository labRequestRepository;
    private final Clock clock;

    public LabRequestService(LabRequestRepository labRequestRepository, Clock clock) {
        this.labRequestRepository = labRequestRepository;
        this.clock = clock;
    }

    public List<LabRequest> getLabRequests(String patientId, String status) {
        boolean byPatient = patientId != null && !patientId.isBlank();
        if (status == null || status.isBlank()) {
            return byPatient ? labRequestRepository.findByPatientId(patientId, NEWEST_FIRST)
                    : labRequestRepository.findAll(NEWEST_FIRST);
        }
        LabRequestStatus parsed = LabRequestStatus.fromValue(status);
        return byPatient ? labRequestRepository.findByPatientIdAndStatus(patientId, parsed, NEWEST_FIRST)
                : labRequestRepository.findByStatus(parsed, NEWEST_FIRST);
    }

    public LabRequest createLabRequest(Patient patient, LabWorkRequest request) {
        if (request == null || UserService.isBlank(request.testType())) {
            throw new IllegalArgumentException("Test type is required");
        }
        Instant now = clock.instant();
        LabRequest labRequest = new LabRequest(patient.getPatientId(), request.testType().trim());
        labRequest.setPatient(patient.getId());
        labRequest.setReason(request.reason());
        labRequest.setNotes(request.notes());
        if (!UserService.isBlank(request.urgency())) {
            labRequest.setUrgency(Urgency.fromValue(request.urgency()));
        }
        labRequest.setRequestedDate(now);
        labRequest.setCreatedAt(now);
        labRequest.setUpdatedAt(now);
        LabRequest saved = labRequestRepository.save(labRequest);
        logger.info("Lab request {} ({}) created for patient {}", saved.getTestType(),
                saved.getUrgency().getValue(), patient.getPatientId());
        return saved;
    }

    public LabRequest updateLabRequest(String id, LabRequestUpdate update) {
        if (update == null || UserService.isBlank(update.status())) {
            throw new IllegalArgumentException("Status is required");
        }
        LabRequestStatus status = LabRequestStatus.fromValue(update.status());
        LabRequest labRequest = labRequestRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Lab request not found"));
        Instant now = clock.instant();
        labRequest.setStatus(status);
        if (status == LabRequestStatus.COMPLETED) {
            labRequest.setCompletedDate(now);
        }
        if (update.results() != null) {
            labRequest.setResults(update.results());
        }
        labRequest.setUpdatedAt(now);
        logger.info("Lab request {} set to {}", id, status.getValue());
        return labRequestRepository.save(labRequest);
    }

    public long countPending(String patientId) {
        return labRequestRepository.countByPatientIdAndStatusIn(patientId, PENDING);
    }
}
