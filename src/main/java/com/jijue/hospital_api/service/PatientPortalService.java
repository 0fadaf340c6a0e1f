package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.AppointmentActivity;
import com.jijue.hospital_api.dto.DoctorBrief;
import com.jijue.hospital_api.dto.HealthMetrics;
import com.jijue.hospital_api.dto.PatientOverview;
import com.jijue.hospital_api.dto.RecordsBundle;
import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.AppointmentStatus;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.VitalSigns;
import com.jijue.hospital_api.repository.AppointmentRepository;

/**
 * Read models behind the patient dashboard.
 */
@Service
public class PatientPortalService {

    private final PatientService patientService;
    private final AppointmentRepository appointmentRepository;
    private final DoctorService doctorService;
    private final PrescriptionService prescriptionService;
    private final LabRequestService labRequestService;
    private final MedicalRecordService medicalRecordService;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public PatientPortalService(PatientService patientService, AppointmentRepository appointmentRepository,
                                DoctorService doctorService, PrescriptionService prescriptionService,
                                LabRequestService labRequestService, MedicalRecordService medicalRecordService,
                                MongoTemplate mongoTemplate, Clock clock) {
        this.patientService = patientService;
        this.appointmentRepository = appointmentRepository;
        this.doctorService = doctorService;
        this.prescriptionService = prescriptionService;
        this.labRequestService = labRequestService;
        this.medicalRecordService = medicalRecordService;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public PatientOverview getOverview(String patientId) {
        patientService.getByPatientId(patientId);
        long upcoming = appointmentRepository.countByPatientIdAndStatusInAndAppointmentDateGreaterThanEqual(
                patientId, EnumSet.of(AppointmentStatus.SCHEDULED, AppointmentStatus.CONFIRMED), LocalDate.now(clock));
        List<AppointmentActivity> recent = toActivities(appointmentRepository.findTop3ByPatientIdOrderByAppointmentDateDesc(patientId));
        return new PatientOverview(
                upcoming,
                labRequestService.countPending(patientId),
                prescriptionService.countActive(patientId),
                0,
                recent);
    }

    public HealthMetrics getHealthMetrics(String patientId) {
        VitalSigns vitals = medicalRecordService.getLatestRecord(patientId)
                .map(record -> record.getVitalSigns())
                .orElse(null);
        if (vitals == null) {
            return new HealthMetrics("--/--", "--", "--", "--");
        }
        return new HealthMetrics(
                vitals.getBloodPressure() != null ? vitals.getBloodPressure() : "--/--",
                orPlaceholder(vitals.getHeartRate()),
                orPlaceholder(vitals.getTemperature()),
                orPlaceholder(vitals.getBmi()));
    }

    /**
     * @param statuses comma separated status values, empty for all
     * @param limit    maximum number of entries, 0 for no limit
     */
    public List<AppointmentActivity> getAppointments(String patientId, String statuses, int limit) {
        Query query = new Query(Criteria.where("patientId").is(patientId));
        if (statuses != null && !statuses.isBlank()) {
            List<String> names = Arrays.stream(statuses.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> AppointmentStatus.fromValue(s).name())
                    .toList();
            query.addCriteria(Criteria.where("status").in(names));
        }
        query.with(Sort.by(Sort.Order.desc("appointmentDate"), Sort.Order.desc("appointmentTime")));
        if (limit > 0) {
            query.limit(limit);
        }
        return toActivities(mongoTemplate.find(query, Appointment.class));
    }

    public RecordsBundle getRecordsBundle(String patientId) {
        Patient patient = patientService.getByPatientId(patientId);
        List<Appointment> appointments = appointmentRepository.findByPatientIdOrderByAppointmentDateDesc(patientId);
        Map<String, Doctor> doctors = doctorService.findAllByIds(appointments.stream()
                .map(Appointment::getDoctor)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet()));

        List<RecordsBundle.VisitEntry> visits = appointments.stream()
                .map(a -> new RecordsBundle.VisitEntry(
                        a.getAppointmentId(),
                        a.getAppointmentDate(),
                        a.getAppointmentTime(),
                        doctors.containsKey(a.getDoctor()) ? doctors.get(a.getDoctor()).getName() : "N/A",
                        a.getReason(),
                        a.getDiagnosis(),
                        a.getNotes(),
                        a.getStatus().getValue()))
                .toList();

        RecordsBundle.PatientCard card = new RecordsBundle.PatientCard(
                patient.getFullName(),
                patient.getPatientId(),
                patient.getDateOfBirth(),
                patient.getBloodType() != null ? patient.getBloodType().getValue() : null,
                patient.getGender() != null ? patient.getGender().getValue() : null,
                patient.getPhone(),
                patient.getEmail());

        return new RecordsBundle(card,
                medicalRecordService.getRecords(patientId),
                visits,
                prescriptionService.getPrescriptions(patientId, null));
    }

    private List<AppointmentActivity> toActivities(List<Appointment> appointments) {
        Map<String, Doctor> doctors = doctorService.findAllByIds(appointments.stream()
                .map(Appointment::getDoctor)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet()));
        return appointments.stream()
                .map(a -> new AppointmentActivity(
                        a.getId(),
                        a.getAppointmentId(),
                        a.getType() != null ? a.getType().getValue() : null,
                        a.getConsultationType() != null ? a.getConsultationType().getValue() : null,
                        a.getAppointmentDate(),
                        a.getAppointmentTime(),
                        a.getStatus().getValue(),
                        a.getReason(),
                        doctors.containsKey(a.getDoctor()) ? DoctorBrief.of(doctors.get(a.getDoctor())) : DoctorBrief.unknown()))
                .toList();
    }

    private static String orPlaceholder(Object value) {
        return value != null ? value.toString() : "--";
    }
}
