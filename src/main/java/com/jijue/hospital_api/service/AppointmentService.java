package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.AppointmentRequest;
import com.jijue.hospital_api.dto.AppointmentSearchCriteria;
import com.jijue.hospital_api.dto.AppointmentStats;
import com.jijue.hospital_api.dto.AppointmentUpdateRequest;
import com.jijue.hospital_api.dto.CancellationRequest;
import com.jijue.hospital_api.dto.PageResult;
import com.jijue.hospital_api.dto.Pagination;
import com.jijue.hospital_api.dto.RescheduleRequest;
import com.jijue.hospital_api.dto.StatusUpdateRequest;
import com.jijue.hospital_api.exception.AppointmentConflictException;
import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.AppointmentStatus;
import com.jijue.hospital_api.model.AppointmentType;
import com.jijue.hospital_api.model.Cancellation;
import com.jijue.hospital_api.model.ConsultationType;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.DoctorStatus;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.PrescriptionItem;
import com.jijue.hospital_api.model.Priority;
import com.jijue.hospital_api.model.VitalSigns;
import com.jijue.hospital_api.repository.AppointmentRepository;
import com.jijue.hospital_api.repository.PatientRepository;
import com.jijue.hospital_api.util.BusinessIds;
import com.jijue.hospital_api.util.TimeOfDay;

/**
 * Booking and lifecycle of appointments. Every write that moves an appointment
 * in time goes through {@link #findConflicts} first.
 */
@Service
public class AppointmentService {

    private static final Logger logger = LoggerFactory.getLogger(AppointmentService.class);

    public static final String CONFLICT_MESSAGE = "Doctor already has an appointment at this time";

    private static final Map<String, String> SORT_FIELDS = Map.of(
            "appointmentDate", "appointmentDate",
            "date", "appointmentDate",
            "createdAt", "createdAt",
            "status", "status",
            "priority", "priority");

    private final AppointmentRepository appointmentRepository;
    private final PatientRepository patientRepository;
    private final DoctorService doctorService;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public AppointmentService(AppointmentRepository appointmentRepository, PatientRepository patientRepository,
                              DoctorService doctorService, MongoTemplate mongoTemplate, Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.patientRepository = patientRepository;
        this.doctorService = doctorService;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    /**
     * Appointments of {@code doctor} on {@code date} that still hold time and whose
     * slot intersects [time, time + duration). {@code excludeId} skips the
     * appointment being moved.
     *
     * @param doctor database id of the doctor
     */
    public List<Appointment> findConflicts(String doctor, LocalDate date, String time, Integer duration, String excludeId) {
        int start = TimeOfDay.toMinutes(time);
        int end = start + (duration != null ? duration : Appointment.DEFAULT_DURATION);
        return appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn(doctor, date, AppointmentStatus.BLOCKING)
                .stream()
                .filter(existing -> excludeId == null || !excludeId.equals(existing.getId()))
                .filter(existing -> existing.overlaps(start, end))
                .toList();
    }

    public Appointment createAppointment(AppointmentRequest request) {
        List<String> missing = new ArrayList<>();
        if (UserService.isBlank(request.patientId())) missing.add("patientId");
        if (UserService.isBlank(request.doctorId())) missing.add("doctorId");
        if (request.appointmentDate() == null) missing.add("appointmentDate");
        if (UserService.isBlank(request.appointmentTime())) missing.add("appointmentTime");
        if (UserService.isBlank(request.reason())) missing.add("reason");
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required fields: " + String.join(", ", missing));
        }
        if (!TimeOfDay.isValid(request.appointmentTime())) {
            throw new IllegalArgumentException("Invalid time format. Use HH:MM (24-hour format)");
        }
        validateDuration(request.duration());

        Patient patient = patientRepository.findByPatientId(request.patientId())
                .orElseThrow(() -> new NoSuchElementException("Patient not found"));
        Doctor doctor = doctorService.resolve(request.doctorId());
        if (doctor.getStatus() != DoctorStatus.ACTIVE) {
            throw new IllegalArgumentException("Doctor is not accepting appointments");
        }

        String time = TimeOfDay.normalize(request.appointmentTime());
        List<Appointment> conflicts = findConflicts(doctor.getId(), request.appointmentDate(), time, request.duration(), null);
        if (!conflicts.isEmpty()) {
            logger.warn("Booking for doctor {} on {} at {} rejected: {} conflict(s)",
                    doctor.getDoctorId(), request.appointmentDate(), time, conflicts.size());
            throw new AppointmentConflictException(CONFLICT_MESSAGE, conflicts);
        }

        Appointment appointment = new Appointment(doctor.getId(), request.appointmentDate(), time, request.duration());
        appointment.setAppointmentId(BusinessIds.appointmentId(clock.millis()));
        appointment.setPatient(patient.getId());
        appointment.setPatientId(patient.getPatientId());
        appointment.setDoctorId(doctor.getDoctorId());
        appointment.setDepartment(doctor.getDepartment());
        if (request.type() != null) appointment.setType(AppointmentType.fromValue(request.type()));
        if (request.consultationType() != null) appointment.setConsultationType(ConsultationType.fromValue(request.consultationType()));
        if (request.priority() != null) appointment.setPriority(Priority.fromValue(request.priority()));
        appointment.setReason(request.reason().trim());
        appointment.setSymptoms(request.symptoms());
        appointment.setNotes(request.notes());
        Instant now = clock.instant();
        appointment.setCreatedAt(now);
        appointment.setUpdatedAt(now);
        appointment.prepareForSave();

        Appointment saved = appointmentRepository.save(appointment);
        rejectIfLostRace(saved);
        logger.info("Appointment {} booked: patient {} with doctor {} on {} at {}",
                saved.getAppointmentId(), saved.getPatientId(), saved.getDoctorId(),
                saved.getAppointmentDate(), saved.getAppointmentTime());
        return refresh(saved);
    }

    /**
     * Two bookings can both pass the pre-insert check. After inserting, the one
     * with the greater id gives way so exactly one of them survives.
     */
    private void rejectIfLostRace(Appointment saved) {
        List<Appointment> racing = findConflicts(saved.getDoctor(), saved.getAppointmentDate(),
                saved.getAppointmentTime(), saved.getDuration(), saved.getId());
        List<Appointment> earlier = racing.stream()
                .filter(other -> other.getId() != null && other.getId().compareTo(saved.getId()) < 0)
                .toList();
        if (!earlier.isEmpty()) {
            appointmentRepository.deleteById(saved.getId());
            logger.warn("Appointment {} lost a concurrent booking race and was removed", saved.getAppointmentId());
            throw new AppointmentConflictException(CONFLICT_MESSAGE, earlier);
        }
    }

    /** Looks an appointment up by database id, then by APT code. */
    public Appointment getAppointment(String id) {
        return refresh(appointmentRepository.findById(id)
                .or(() -> appointmentRepository.findByAppointmentId(id))
                .orElseThrow(() -> new NoSuchElementException("Appointment not found")));
    }

    private Appointment refresh(Appointment appointment) {
        appointment.refreshTiming(LocalDateTime.now(clock));
        return appointment;
    }

    private List<Appointment> refresh(List<Appointment> appointments) {
        LocalDateTime now = LocalDateTime.now(clock);
        appointments.forEach(appointment -> appointment.refreshTiming(now));
        return appointments;
    }

    public Appointment updateAppointment(String id, AppointmentUpdateRequest update) {
        Appointment appointment = getAppointment(id);

        LocalDate date = update.appointmentDate() != null ? update.appointmentDate() : appointment.getAppointmentDate();
        String time = update.appointmentTime() != null ? TimeOfDay.normalize(update.appointmentTime()) : appointment.getAppointmentTime();
        Integer duration = update.duration() != null ? update.duration() : appointment.getDuration();
        validateDuration(duration);
        boolean moved = !Objects.equals(date, appointment.getAppointmentDate())
                || !Objects.equals(time, appointment.getAppointmentTime())
                || !Objects.equals(duration, appointment.getDuration());
        if (moved) {
            List<Appointment> conflicts = findConflicts(appointment.getDoctor(), date, time, duration, appointment.getId());
            if (!conflicts.isEmpty()) {
                throw new AppointmentConflictException(CONFLICT_MESSAGE, conflicts);
            }
            appointment.setAppointmentDate(date);
            appointment.setAppointmentTime(time);
            appointment.setDuration(duration);
        }

        if (update.type() != null) appointment.setType(AppointmentType.fromValue(update.type()));
        if (update.consultationType() != null) appointment.setConsultationType(ConsultationType.fromValue(update.consultationType()));
        if (update.reason() != null) appointment.setReason(update.reason());
        if (update.symptoms() != null) appointment.setSymptoms(update.symptoms());
        if (update.diagnosis() != null) appointment.setDiagnosis(update.diagnosis());
        if (update.priority() != null) appointment.setPriority(Priority.fromValue(update.priority()));
        if (update.status() != null) appointment.setStatus(AppointmentStatus.fromValue(update.status()));
        if (update.notes() != null) appointment.setNotes(update.notes());
        if (update.doctorNotes() != null) appointment.setDoctorNotes(update.doctorNotes());
        if (update.nurseNotes() != null) appointment.setNurseNotes(update.nurseNotes());
        if (update.followUp() != null) appointment.setFollowUp(update.followUp());

        appointment.prepareForSave();
        appointment.setUpdatedAt(clock.instant());
        logger.info("Appointment {} updated", appointment.getAppointmentId());
        return refresh(appointmentRepository.save(appointment));
    }

    public void deleteAppointment(String id) {
        Appointment appointment = getAppointment(id);
        appointmentRepository.delete(appointment);
        logger.warn("Appointment {} deleted", appointment.getAppointmentId());
    }

    public PageResult<Appointment> searchAppointments(AppointmentSearchCriteria criteria) {
        Query query = new Query();
        if (!UserService.isBlank(criteria.patientId())) {
            query.addCriteria(Criteria.where("patientId").is(criteria.patientId()));
        }
        if (!UserService.isBlank(criteria.doctorId())) {
            query.addCriteria(new Criteria().orOperator(
                    Criteria.where("doctor").is(criteria.doctorId()),
                    Criteria.where("doctorId").is(criteria.doctorId())));
        }
        if (!UserService.isBlank(criteria.status())) {
            query.addCriteria(Criteria.where("status").is(AppointmentStatus.fromValue(criteria.status()).name()));
        }
        if (criteria.date() != null) {
            query.addCriteria(Criteria.where("appointmentDate").is(criteria.date()));
        }
        if (!UserService.isBlank(criteria.type())) {
            query.addCriteria(Criteria.where("type").is(AppointmentType.fromValue(criteria.type()).name()));
        }

        int page = Math.max(criteria.page(), 1);
        int limit = criteria.limit() > 0 ? Math.min(criteria.limit(), 100) : 10;
        String field = SORT_FIELDS.getOrDefault(criteria.sortBy() == null ? "appointmentDate" : criteria.sortBy(), "appointmentDate");
        Sort.Direction direction = "desc".equalsIgnoreCase(criteria.sortOrder()) ? Sort.Direction.DESC : Sort.Direction.ASC;

        long total = mongoTemplate.count(query, Appointment.class);
        query.with(Sort.by(new Sort.Order(direction, field), new Sort.Order(direction, "appointmentTime")))
                .skip((long) (page - 1) * limit)
                .limit(limit);
        return new PageResult<>(refresh(mongoTemplate.find(query, Appointment.class)), Pagination.of(page, limit, total));
    }

    /**
     * @param upcoming "true" (default) for today onwards, "false" for earlier dates, "all" for both
     */
    public List<Appointment> getPatientAppointments(String patientId, String status, String upcoming) {
        Query query = new Query(Criteria.where("patientId").is(patientId));
        if (!UserService.isBlank(status)) {
            query.addCriteria(Criteria.where("status").is(AppointmentStatus.fromValue(status).name()));
        }
        LocalDate today = LocalDate.now(clock);
        String mode = upcoming == null ? "true" : upcoming.trim().toLowerCase();
        if ("true".equals(mode)) {
            query.addCriteria(Criteria.where("appointmentDate").gte(today));
        } else if ("false".equals(mode)) {
            query.addCriteria(Criteria.where("appointmentDate").lt(today));
        } else if (!"all".equals(mode)) {
            throw new IllegalArgumentException("upcoming must be true, false or all");
        }
        query.with(Sort.by(Sort.Order.asc("appointmentDate"), Sort.Order.asc("appointmentTime")));
        return refresh(mongoTemplate.find(query, Appointment.class));
    }

    public List<Appointment> getDoctorAppointments(String doctorId, LocalDate date, String status) {
        Doctor doctor = doctorService.resolve(doctorId);
        Query query = new Query(Criteria.where("doctor").is(doctor.getId()));
        if (date != null) {
            query.addCriteria(Criteria.where("appointmentDate").is(date));
        }
        if (!UserService.isBlank(status)) {
            query.addCriteria(Criteria.where("status").is(AppointmentStatus.fromValue(status).name()));
        }
        query.with(Sort.by(Sort.Order.asc("appointmentDate"), Sort.Order.asc("appointmentTime")));
        return refresh(mongoTemplate.find(query, Appointment.class));
    }

    public Appointment updateStatus(String id, StatusUpdateRequest request) {
        if (request == null || UserService.isBlank(request.status())) {
            throw new IllegalArgumentException("Status is required");
        }
        AppointmentStatus status = AppointmentStatus.fromValue(request.status());
        Appointment appointment = getAppointment(id);
        appointment.setStatus(status);
        if (request.notes() != null) {
            appointment.setNotes(request.notes());
        }
        appointment.setUpdatedAt(clock.instant());
        logger.info("Appointment {} status set to {}", appointment.getAppointmentId(), status.getValue());
        return refresh(appointmentRepository.save(appointment));
    }

    public Appointment cancelAppointment(String id, CancellationRequest request, String defaultCancelledBy) {
        Appointment appointment = getAppointment(id);
        if (appointment.getStatus() == AppointmentStatus.COMPLETED || appointment.getStatus() == AppointmentStatus.CANCELLED) {
            throw new IllegalArgumentException("Cannot cancel a " + appointment.getStatus().getValue() + " appointment");
        }
        String reason = request == null || UserService.isBlank(request.reason()) ? "No reason provided" : request.reason();
        String cancelledBy = request == null || UserService.isBlank(request.cancelledBy()) ? defaultCancelledBy : request.cancelledBy();
        Instant now = clock.instant();
        appointment.setStatus(AppointmentStatus.CANCELLED);
        appointment.setCancellation(new Cancellation(reason, cancelledBy, now));
        appointment.setUpdatedAt(now);
        logger.info("Appointment {} cancelled by {}", appointment.getAppointmentId(), cancelledBy);
        return refresh(appointmentRepository.save(appointment));
    }

    public Appointment rescheduleAppointment(String id, RescheduleRequest request) {
        if (request == null || request.newDate() == null || UserService.isBlank(request.newTime())) {
            throw new IllegalArgumentException("New date and time are required");
        }
        if (!TimeOfDay.isValid(request.newTime())) {
            throw new IllegalArgumentException("Invalid time format. Use HH:MM (24-hour format)");
        }
        Appointment appointment = getAppointment(id);
        if (appointment.getStatus().isFinal()) {
            throw new IllegalArgumentException("Cannot reschedule a " + appointment.getStatus().getValue() + " appointment");
        }
        String time = TimeOfDay.normalize(request.newTime());
        List<Appointment> conflicts = findConflicts(appointment.getDoctor(), request.newDate(), time,
                appointment.getDuration(), appointment.getId());
        if (!conflicts.isEmpty()) {
            throw new AppointmentConflictException(CONFLICT_MESSAGE, conflicts);
        }
        LocalDate previousDate = appointment.getAppointmentDate();
        String previousTime = appointment.getAppointmentTime();
        appointment.setAppointmentDate(request.newDate());
        appointment.setAppointmentTime(time);
        appointment.setStatus(AppointmentStatus.RESCHEDULED);
        if (!UserService.isBlank(request.reason())) {
            String note = "Rescheduled: " + request.reason();
            appointment.setNotes(UserService.isBlank(appointment.getNotes()) ? note : appointment.getNotes() + "\n" + note);
        }
        appointment.setUpdatedAt(clock.instant());
        logger.info("Appointment {} moved from {} {} to {} {}", appointment.getAppointmentId(),
                previousDate, previousTime, request.newDate(), time);
        return refresh(appointmentRepository.save(appointment));
    }

    public Appointment addPrescription(String id, PrescriptionItem item) {
        if (item == null || UserService.isBlank(item.getMedication())) {
            throw new IllegalArgumentException("Medication is required");
        }
        Appointment appointment = getAppointment(id);
        appointment.getPrescription().add(item);
        appointment.setUpdatedAt(clock.instant());
        logger.info("Prescription {} added to appointment {}", item.getMedication(), appointment.getAppointmentId());
        return refresh(appointmentRepository.save(appointment));
    }

    public Appointment recordVitals(String id, VitalSigns vitals) {
        if (vitals == null) {
            throw new IllegalArgumentException("Vital signs are required");
        }
        Appointment appointment = getAppointment(id);
        appointment.setVitalSigns(vitals);
        appointment.prepareForSave();
        appointment.setUpdatedAt(clock.instant());
        logger.info("Vitals recorded for appointment {}", appointment.getAppointmentId());
        return refresh(appointmentRepository.save(appointment));
    }

    public AppointmentStats getStats() {
        LocalDate today = LocalDate.now(clock);
        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (AppointmentStatus status : AppointmentStatus.values()) {
            breakdown.put(status.getValue(), appointmentRepository.countByStatus(status));
        }
        return new AppointmentStats(
                appointmentRepository.count(),
                appointmentRepository.countByAppointmentDate(today),
                appointmentRepository.countByStatusInAndAppointmentDateGreaterThanEqual(AppointmentStatus.UPCOMING, today),
                breakdown);
    }

    private static void validateDuration(Integer duration) {
        if (duration != null && (duration < 15 || duration > 120)) {
            throw new IllegalArgumentException("Duration must be between 15 and 120 minutes");
        }
    }
}
