package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.ContactMessageRequest;
import com.jijue.hospital_api.model.ContactInfo;
import com.jijue.hospital_api.model.ContactSubmission;
import com.jijue.hospital_api.model.SubmissionStatus;
import com.jijue.hospital_api.repository.ContactInfoRepository;
import com.jijue.hospital_api.repository.ContactSubmissionRepository;

@Service
public class ContactService {

    private static final Logger logger = LoggerFactory.getLogger(ContactService.class);

    public static final String THANK_YOU = "Thank you for your message. We will get back to you soon.";

    private final ContactInfoRepository contactInfoRepository;
    private final ContactSubmissionRepository contactSubmissionRepository;
    private final Clock clock;

    public ContactService(ContactInfoRepository contactInfoRepository,
                          ContactSubmissionRepository contactSubmissionRepository, Clock clock) {
        this.contactInfoRepository = contactInfoRepository;
        this.contactSubmissionRepository = contactSubmissionRepository;
        this.clock = clock;
    }

    /** The stored contact document, or the built-in defaults when none was saved. */
    public ContactInfo getContactInfo() {
        return contactInfoRepository.findFirstByOrderByIdAsc().orElseGet(ContactInfo::defaults);
    }

    public ContactSubmission submit(ContactMessageRequest request, String ipAddress) {
        if (request == null || UserService.isBlank(request.name()) || UserService.isBlank(request.email())
                || UserService.isBlank(request.subject()) || UserService.isBlank(request.message())) {
            throw new IllegalArgumentException("Please fill in all required fields");
        }
        ContactSubmission submission = new ContactSubmission();
        submission.setName(request.name().trim());
        submission.setEmail(UserService.normalizeEmail(request.email()));
        submission.setPhone(request.phone());
        submission.setSubject(request.subject().trim());
        submission.setDepartment(request.department());
        submission.setMessage(request.message().trim());
        if (!UserService.isBlank(request.source())) {
            submission.setSource(request.source());
        }
        submission.setIpAddress(ipAddress);
        Instant now = clock.instant();
        submission.setCreatedAt(now);
        submission.setUpdatedAt(now);
        ContactSubmission saved = contactSubmissionRepository.save(submission);
        logger.info("Contact message '{}' received from {}", saved.getSubject(), saved.getEmail());
        return saved;
    }

    public List<ContactSubmission> getSubmissions(String status) {
        if (status == null || status.isBlank()) {
            return contactSubmissionRepository.findAllByOrderByCreatedAtDesc();
        }
        return contactSubmissionRepository.findByStatusOrderByCreatedAtDesc(SubmissionStatus.fromValue(status));
    }

    public ContactSubmission updateStatus(String id, String status) {
        if (UserService.isBlank(status)) {
            throw new IllegalArgumentException("Status is required");
        }
        SubmissionStatus parsed = SubmissionStatus.fromValue(status);
        ContactSubmission submission = contactSubmissionRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Submission not found"));
        submission.setStatus(parsed);
        submission.setUpdatedAt(clock.instant());
        logger.info("Contact submission {} marked {}", id, parsed.getValue());
        return contactSubmissionRepository.save(submission);
    }
}
