package com.jijue.hospital_api.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.LabRequest;
import com.jijue.hospital_api.model.LabRequestStatus;

@Repository
public interface LabRequestRepository extends MongoRepository<LabRequest, String> {
    List<LabRequest> findByPatientId(String patientId, Sort sort);
    List<LabRequest> findByStatus(LabRequestStatus status, Sort sort);
    List<LabRequest> findByPatientIdAndStatus(String patientId, LabRequestStatus status, Sort sort);
    long countByPatientIdAndStatusIn(String patientId, Collection<LabRequestStatus> statuses);
}
