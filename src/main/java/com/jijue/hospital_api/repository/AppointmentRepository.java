package com.jijue.hospital_api.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.AppointmentStatus;

@Repository
public interface AppointmentRepository extends MongoRepository<Appointment, String> {
    Optional<Appointment> findByAppointmentId(String appointmentId);
    List<Appointment> findByDoctorAndAppointmentDateAndStatusIn(String doctor, LocalDate appointmentDate, Collection<AppointmentStatus> statuses);
    List<Appointment> findByPatientIdOrderByAppointmentDateDesc(String patientId);
    List<Appointment> findTop3ByPatientIdOrderByAppointmentDateDesc(String patientId);
    long countByPatientIdAndStatusInAndAppointmentDateGreaterThanEqual(String patientId, Collection<AppointmentStatus> statuses, LocalDate from);
    long countByAppointmentDate(LocalDate appointmentDate);
    long countByStatusInAndAppointmentDateGreaterThanEqual(Collection<AppointmentStatus> statuses, LocalDate from);
    long countByStatus(AppointmentStatus status);
}
