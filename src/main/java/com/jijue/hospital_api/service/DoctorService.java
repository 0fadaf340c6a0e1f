package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.DaySchedule;
import com.jijue.hospital_api.dto.DoctorSearchCriteria;
import com.jijue.hospital_api.dto.DoctorStats;
import com.jijue.hospital_api.dto.DoctorUpdateRequest;
import com.jijue.hospital_api.dto.PageResult;
import com.jijue.hospital_api.dto.Pagination;
import com.jijue.hospital_api.dto.SpecialtyCount;
import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.AppointmentStatus;
import com.jijue.hospital_api.model.Availability;
import com.jijue.hospital_api.model.AvailabilityCheck;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.DoctorStatus;
import com.jijue.hospital_api.model.Qualification;
import com.jijue.hospital_api.model.Specialization;
import com.jijue.hospital_api.model.TimeSlot;
import com.jijue.hospital_api.repository.AppointmentRepository;
import com.jijue.hospital_api.repository.DoctorRepository;
import com.jijue.hospital_api.util.BusinessIds;
import com.jijue.hospital_api.util.TimeOfDay;

@Service
public class DoctorService {

    private static final Logger logger = LoggerFactory.getLogger(DoctorService.class);

    private static final Pattern LICENSE = Pattern.compile("^[A-Z0-9]{6,15}$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s\\-()]{10,}$");

    private static final Map<String, String> SORT_FIELDS = Map.of(
            "rating", "rating.average",
            "experience", "yearsOfExperience",
            "name", "name",
            "fee", "consultationFee");

    private final DoctorRepository doctorRepository;
    private final AppointmentRepository appointmentRepository;
    private final MongoTemplate mongoTemplate;
    private final UserService userService;
    private final Clock clock;

    public DoctorService(DoctorRepository doctorRepository, AppointmentRepository appointmentRepository,
                         MongoTemplate mongoTemplate, UserService userService, Clock clock) {
        this.doctorRepository = doctorRepository;
        this.appointmentRepository = appointmentRepository;
        this.mongoTemplate = mongoTemplate;
        this.userService = userService;
        this.clock = clock;
    }

    /**
     * Directory search over active doctors.
     */
    public PageResult<Doctor> searchDoctors(DoctorSearchCriteria criteria) {
        List<Criteria> filters = new ArrayList<>();
        filters.add(Criteria.where("status").is(DoctorStatus.ACTIVE.name()));
        if (!UserService.isBlank(criteria.specialization())) {
            filters.add(Criteria.where("specialization").is(Specialization.fromValue(criteria.specialization()).name()));
        }
        if (!UserService.isBlank(criteria.department())) {
            filters.add(Criteria.where("department").is(criteria.department()));
        }
        if (!UserService.isBlank(criteria.search())) {
            Pattern pattern = Pattern.compile(Pattern.quote(criteria.search().trim()), Pattern.CASE_INSENSITIVE);
            filters.add(new Criteria().orOperator(
                    Criteria.where("name").regex(pattern),
                    Criteria.where("specialization").regex(pattern),
                    Criteria.where("bio").regex(pattern),
                    Criteria.where("qualifications.degree").regex(pattern),
                    Criteria.where("qualifications.institution").regex(pattern)));
        }
        if (criteria.experience() != null) {
            filters.add(Criteria.where("yearsOfExperience").gte(criteria.experience()));
        }
        if (criteria.rating() != null) {
            filters.add(Criteria.where("rating.average").gte(criteria.rating()));
        }
        if (!UserService.isBlank(criteria.language())) {
            filters.add(Criteria.where("languages").regex(
                    Pattern.compile("^" + Pattern.quote(criteria.language().trim()) + "$", Pattern.CASE_INSENSITIVE)));
        }
        if (criteria.available() != null) {
            filters.add(Criteria.where("available").is(criteria.available()));
        }
        if (criteria.verified() != null) {
            filters.add(Criteria.where("verified").is(criteria.verified()));
        }

        int page = Math.max(criteria.page(), 1);
        int limit = criteria.limit() > 0 ? Math.min(criteria.limit(), 100) : 10;
        String sortField = SORT_FIELDS.getOrDefault(criteria.sortBy() == null ? "rating" : criteria.sortBy(), "rating.average");
        Sort.Direction direction = "asc".equalsIgnoreCase(criteria.sortOrder()) ? Sort.Direction.ASC : Sort.Direction.DESC;

        Query query = new Query(new Criteria().andOperator(filters.toArray(new Criteria[0])));
        long total = mongoTemplate.count(query, Doctor.class);
        query.with(Sort.by(direction, sortField)).skip((long) (page - 1) * limit).limit(limit);
        List<Doctor> doctors = mongoTemplate.find(query, Doctor.class);
        doctors.forEach(this::refresh);
        return new PageResult<>(doctors, Pagination.of(page, limit, total));
    }

    public List<Doctor> getAvailableDoctors() {
        List<Doctor> doctors = doctorRepository.findByStatusAndAvailableTrueAndVerifiedTrue(
                DoctorStatus.ACTIVE, Sort.by(Sort.Direction.DESC, "rating.average"));
        doctors.forEach(this::refresh);
        return doctors;
    }

    public Doctor getDoctorById(String id) {
        return refresh(doctorRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Doctor not found")));
    }

    public Doctor getByDoctorId(String doctorId) {
        return refresh(doctorRepository.findByDoctorId(doctorId)
                .orElseThrow(() -> new NoSuchElementException("Doctor not found")));
    }

    /** Looks a doctor up by database id first, then by DOC code. */
    public Doctor resolve(String idOrCode) {
        if (UserService.isBlank(idOrCode)) {
            throw new NoSuchElementException("Doctor not found");
        }
        return doctorRepository.findById(idOrCode)
                .or(() -> doctorRepository.findByDoctorId(idOrCode))
                .orElseThrow(() -> new NoSuchElementException("Doctor not found"));
    }

    public Doctor createDoctor(Doctor doctor) {
        doctor.setId(null);
        validate(doctor);
        if (doctorRepository.existsByLicenseNumber(doctor.getLicenseNumber())) {
            logger.warn("Duplicate license number {}", doctor.getLicenseNumber());
            throw new IllegalArgumentException("Doctor with this license number already exists");
        }
        if (doctorRepository.existsByEmail(doctor.getEmail())) {
            logger.warn("Duplicate doctor email {}", doctor.getEmail());
            throw new IllegalArgumentException("Doctor with this email already exists");
        }
        String password = doctor.getPassword();
        boolean withAccount = password != null && !password.isBlank();
        if (withAccount) {
            if (password.length() < 8) {
                throw new IllegalArgumentException("Password must be at least 8 characters long");
            }
            userService.ensureAccountAvailable(doctor.getEmail());
        }

        Instant now = clock.instant();
        doctor.setDoctorId(BusinessIds.doctorId(clock.millis()));
        doctor.setCreatedAt(now);
        doctor.setUpdatedAt(now);
        Doctor saved = doctorRepository.save(doctor);
        logger.info("Doctor {} ({}) created", saved.getDoctorId(), saved.getName());

        if (withAccount) {
            try {
                userService.createDoctorAccount(saved, password);
            } catch (RuntimeException e) {
                logger.error("Login account for doctor {} failed, removing the profile: {}",
                        saved.getDoctorId(), e.getMessage());
                doctorRepository.deleteById(saved.getId());
                throw e;
            }
        }
        return refresh(saved);
    }

    /**
     * Partial update. Administrative fields are only applied for administrators.
     */
    public Doctor updateDoctor(String id, DoctorUpdateRequest update, boolean admin) {
        Doctor doctor = doctorRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Doctor not found"));

        if (update.name() != null) doctor.setName(update.name());
        if (update.specialization() != null) doctor.setSpecialization(Specialization.fromValue(update.specialization()));
        if (update.yearsOfExperience() != null) doctor.setYearsOfExperience(update.yearsOfExperience());
        if (update.bio() != null) doctor.setBio(update.bio());
        if (update.consultationFee() != null) doctor.setConsultationFee(update.consultationFee());
        if (update.availability() != null) doctor.setAvailability(update.availability());
        if (update.isAvailable() != null) doctor.setAvailable(update.isAvailable());
        if (update.phone() != null) doctor.setPhone(update.phone());
        if (update.address() != null) doctor.setAddress(update.address());
        if (update.profileImage() != null) doctor.setProfileImage(update.profileImage());
        if (update.languages() != null) doctor.setLanguages(update.languages());
        if (update.department() != null) doctor.setDepartment(update.department());
        if (update.preferences() != null) doctor.setPreferences(update.preferences());
        if (update.email() != null) {
            String email = UserService.normalizeEmail(update.email());
            if (!email.equals(doctor.getEmail()) && doctorRepository.existsByEmail(email)) {
                throw new IllegalArgumentException("Doctor with this email already exists");
            }
            doctor.setEmail(email);
        }

        boolean restricted = update.licenseNumber() != null || update.status() != null || update.verified() != null;
        if (restricted && !admin) {
            logger.warn("Ignoring administrative fields in self-update of doctor {}", doctor.getDoctorId());
        } else if (restricted) {
            if (update.licenseNumber() != null) {
                String license = update.licenseNumber().trim().toUpperCase();
                if (!license.equals(doctor.getLicenseNumber()) && doctorRepository.existsByLicenseNumber(license)) {
                    throw new IllegalArgumentException("Doctor with this license number already exists");
                }
                doctor.setLicenseNumber(license);
            }
            if (update.status() != null) doctor.setStatus(DoctorStatus.fromValue(update.status()));
            if (update.verified() != null) doctor.setVerified(update.verified());
        }

        validate(doctor);
        doctor.setUpdatedAt(clock.instant());
        logger.info("Doctor {} updated", doctor.getDoctorId());
        return refresh(doctorRepository.save(doctor));
    }

    /**
     * The doctor's slots on {@code date} with every slot that overlaps a
     * still-active appointment removed.
     */
    public DaySchedule getDaySchedule(String id, LocalDate date) {
        Doctor doctor = resolve(id);
        Availability availability = doctor.getAvailability();
        List<Appointment> booked = appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn(
                doctor.getId(), date, AppointmentStatus.BLOCKING);

        int slotDuration = availability.getSlotDuration();
        List<TimeSlot> open = new ArrayList<>();
        for (TimeSlot slot : doctor.generateTimeSlots(date)) {
            int start = TimeOfDay.toMinutes(slot.time());
            boolean taken = booked.stream().anyMatch(a -> a.overlaps(start, start + slotDuration));
            if (!taken) {
                open.add(slot);
            }
        }
        return new DaySchedule(
                doctor.getId(),
                doctor.getName(),
                date,
                availability.worksOn(date.getDayOfWeek()),
                new DaySchedule.WorkingHours(availability.getStartTime(), availability.getEndTime(),
                        availability.getBreakStart(), availability.getBreakEnd()),
                slotDuration,
                booked.size(),
                open);
    }

    public AvailabilityCheck checkAvailability(String id, LocalDate date, String time) {
        Doctor doctor = resolve(id);
        String normalized = TimeOfDay.normalize(time);
        AvailabilityCheck check = doctor.checkAvailability(date, normalized);
        if (!check.available()) {
            return check;
        }
        int start = TimeOfDay.toMinutes(normalized);
        int end = start + doctor.getAvailability().getSlotDuration();
        boolean booked = appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn(
                        doctor.getId(), date, AppointmentStatus.BLOCKING)
                .stream()
                .anyMatch(a -> a.overlaps(start, end));
        return booked ? AvailabilityCheck.closed("Time slot is already booked") : check;
    }

    public List<Doctor> getDoctorsByDepartment(String departmentId) {
        List<Doctor> doctors = doctorRepository.findByDepartmentAndStatus(departmentId, DoctorStatus.ACTIVE,
                Sort.by(Sort.Direction.DESC, "rating.average"));
        doctors.forEach(this::refresh);
        return doctors;
    }

    public List<SpecialtyCount> getSpecialties() {
        Map<Specialization, Long> counts = doctorRepository.findByStatus(DoctorStatus.ACTIVE).stream()
                .filter(d -> d.getSpecialization() != null)
                .collect(Collectors.groupingBy(Doctor::getSpecialization, Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> new SpecialtyCount(e.getKey().getValue(), e.getKey().getDisplayName(), e.getValue()))
                .sorted(Comparator.comparingLong(SpecialtyCount::count).reversed()
                        .thenComparing(SpecialtyCount::label))
                .toList();
    }

    public DoctorStats getStats() {
        List<Doctor> active = doctorRepository.findByStatus(DoctorStatus.ACTIVE);
        long availableCount = active.stream().filter(Doctor::isAvailable).count();
        double average = active.stream()
                .mapToDouble(d -> d.getRating() == null ? 0 : d.getRating().getAverage())
                .average()
                .orElse(0);
        Map<String, Long> bySpecialization = new TreeMap<>(active.stream()
                .filter(d -> d.getSpecialization() != null)
                .collect(Collectors.groupingBy(d -> d.getSpecialization().getValue(), Collectors.counting())));
        return new DoctorStats(active.size(), availableCount, Math.round(average * 10) / 10.0, bySpecialization);
    }

    public Doctor addQualification(String id, Qualification qualification) {
        if (qualification == null || UserService.isBlank(qualification.getDegree())
                || UserService.isBlank(qualification.getInstitution())) {
            throw new IllegalArgumentException("Degree and institution are required");
        }
        Doctor doctor = doctorRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Doctor not found"));
        doctor.getQualifications().add(qualification);
        doctor.setUpdatedAt(clock.instant());
        logger.info("Qualification {} added to doctor {}", qualification.getDegree(), doctor.getDoctorId());
        return refresh(doctorRepository.save(doctor));
    }

    public Doctor rateDoctor(String id, Integer rating) {
        if (rating == null) {
            throw new IllegalArgumentException("Rating must be between 1 and 5");
        }
        Doctor doctor = doctorRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Doctor not found"));
        doctor.addRating(rating);
        logger.info("Doctor {} rated {} (average now {})", doctor.getDoctorId(), rating, doctor.getRating().getAverage());
        return refresh(doctorRepository.save(doctor));
    }

    public Doctor setAvailability(String id, Boolean isAvailable) {
        if (isAvailable == null) {
            throw new IllegalArgumentException("isAvailable must be true or false");
        }
        Doctor doctor = doctorRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Doctor not found"));
        doctor.setAvailable(isAvailable);
        doctor.setUpdatedAt(clock.instant());
        logger.info("Doctor {} availability set to {}", doctor.getDoctorId(), isAvailable);
        return refresh(doctorRepository.save(doctor));
    }

    /** Soft delete: the record stays for appointment history. */
    public void deactivateDoctor(String id) {
        Doctor doctor = doctorRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Doctor not found"));
        doctor.setStatus(DoctorStatus.INACTIVE);
        doctor.setAvailable(false);
        doctor.setUpdatedAt(clock.instant());
        doctorRepository.save(doctor);
        logger.warn("Doctor {} deactivated", doctor.getDoctorId());
    }

    public Map<String, Doctor> findAllByIds(Iterable<String> ids) {
        Map<String, Doctor> byId = new LinkedHashMap<>();
        doctorRepository.findAllById(ids).forEach(d -> byId.put(d.getId(), d));
        return byId;
    }

    private Doctor refresh(Doctor doctor) {
        doctor.refreshNextAvailable(LocalDateTime.now(clock));
        return doctor;
    }

    private void validate(Doctor doctor) {
        if (UserService.isBlank(doctor.getName())) {
            throw new IllegalArgumentException("Doctor name is required");
        }
        doctor.setName(doctor.getName().trim());
        if (doctor.getName().length() > 100) {
            throw new IllegalArgumentException("Name cannot exceed 100 characters");
        }
        if (doctor.getSpecialization() == null) {
            throw new IllegalArgumentException("Specialization is required");
        }
        if (UserService.isBlank(doctor.getLicenseNumber())) {
            throw new IllegalArgumentException("License number is required");
        }
        doctor.setLicenseNumber(doctor.getLicenseNumber().trim().toUpperCase());
        if (!LICENSE.matcher(doctor.getLicenseNumber()).matches()) {
            throw new IllegalArgumentException("License number must be 6-15 letters or digits");
        }
        if (UserService.isBlank(doctor.getEmail())) {
            throw new IllegalArgumentException("Email is required");
        }
        doctor.setEmail(UserService.normalizeEmail(doctor.getEmail()));
        if (doctor.getPhone() == null || !PHONE.matcher(doctor.getPhone()).matches()) {
            throw new IllegalArgumentException("Please enter a valid phone number");
        }
        if (doctor.getYearsOfExperience() < 0 || doctor.getYearsOfExperience() > 60) {
            throw new IllegalArgumentException("Years of experience must be between 0 and 60");
        }
        if (doctor.getBio() != null && doctor.getBio().length() > 1000) {
            throw new IllegalArgumentException("Bio cannot exceed 1000 characters");
        }
        if (doctor.getConsultationFee() < 0) {
            throw new IllegalArgumentException("Consultation fee cannot be negative");
        }
        doctor.getAvailability().normalizeAndValidate();
    }
}
