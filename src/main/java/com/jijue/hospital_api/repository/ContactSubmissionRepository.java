package com.jijue.hospital_api.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.ContactSubmission;
import com.jijue.hospital_api.model.SubmissionStatus;

@Repository
public interface ContactSubmissionRepository extends MongoRepository<ContactSubmission, String> {
    List<ContactSubmission> findAllByOrderByCreatedAtDesc();
    List<ContactSubmission> findByStatusOrderByCreatedAtDesc(SubmissionStatus status);
}
