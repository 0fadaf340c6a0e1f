package com.jijue.hospital_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;

import com.jijue.hospital_api.dto.AppointmentRequest;
import com.jijue.hospital_api.dto.AppointmentUpdateRequest;
import com.jijue.hospital_api.dto.AppointmentStats;
import com.jijue.hospital_api.dto.CancellationRequest;
import com.jijue.hospital_api.dto.RescheduleRequest;
import com.jijue.hospital_api.dto.StatusUpdateRequest;
import com.jijue.hospital_api.exception.AppointmentConflictException;
import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.AppointmentStatus;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.DoctorStatus;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.Specialization;
import com.jijue.hospital_api.repository.AppointmentRepository;
import com.jijue.hospital_api.repository.PatientRepository;

@ExtendWith(MockitoExtension.class)
class AppointmentServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 10);

    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private PatientRepository patientRepository;
    @Mock
    private DoctorService doctorService;
    @Mock
    private MongoTemplate mongoTemplate;

    private AppointmentService appointmentService;
    private Patient patient;
    private Doctor doctor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-10T05:00:00Z"), ZoneId.of("Africa/Nairobi"));
        appointmentService = new AppointmentService(appointmentRepository, patientRepository, doctorService,
                mongoTemplate, clock);

        patient = new Patient("Achieng", "Odhiambo", LocalDate.of(1995, 3, 2), "achieng@jijue.test");
        patient.setId("p-1");
        patient.setPatientId("PAT123456789");

        doctor = new Doctor("Dr. Kiprono", Specialization.GENERAL_MEDICINE, "KMD99887", "kiprono@jijue.test");
        doctor.setId("d-1");
        doctor.setDoctorId("DOC12345678ABCD");
    }

    private AppointmentRequest booking(String time) {
        return new AppointmentRequest("PAT123456789", "DOC12345678ABCD", DAY, time, 30,
                null, null, "Chest pain", null, null, null);
    }

    private static Appointment existing(String id, String time) {
        Appointment appointment = new Appointment("d-1", DAY, time, 30);
        appointment.setId(id);
        return appointment;
    }

    private void stubLookups() {
        when(patientRepository.findByPatientId("PAT123456789")).thenReturn(Optional.of(patient));
        when(doctorService.resolve("DOC12345678ABCD")).thenReturn(doctor);
    }

    private void stubSaveAssigning(String id) {
        when(appointmentRepository.save(any(Appointment.class))).thenAnswer(invocation -> {
            Appointment appointment = invocation.getArgument(0);
            appointment.setId(id);
            return appointment;
        });
    }

    @Test
    void bookingCopiesPatientAndDoctorReferences() {
        stubLookups();
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of());
        stubSaveAssigning("b");

        Appointment saved = appointmentService.createAppointment(booking("9:30"));

        assertThat(saved.getAppointmentId()).startsWith("APT");
        assertThat(saved.getPatient()).isEqualTo("p-1");
        assertThat(saved.getDoctorId()).isEqualTo("DOC12345678ABCD");
        assertThat(saved.getAppointmentTime()).isEqualTo("09:30");
        assertThat(saved.getStatus()).isEqualTo(AppointmentStatus.SCHEDULED);
    }

    @Test
    void overlappingBookingIsRejected() {
        stubLookups();
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(existing("a", "10:00")));

        AppointmentConflictException thrown = catchThrowableOfType(
                () -> appointmentService.createAppointment(booking("10:15")), AppointmentConflictException.class);

        assertThat(thrown).hasMessage(AppointmentService.CONFLICT_MESSAGE);
        assertThat(thrown.getConflicts()).extracting(Appointment::getId).containsExactly("a");
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void backToBackBookingIsAllowed() {
        stubLookups();
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(existing("a", "10:00")));
        stubSaveAssigning("b");

        Appointment saved = appointmentService.createAppointment(booking("10:30"));

        assertThat(saved.getId()).isEqualTo("b");
    }

    @Test
    void laterOfTwoRacingBookingsIsRemoved() {
        stubLookups();
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(), List.of(existing("a", "10:00")));
        stubSaveAssigning("b");

        assertThatThrownBy(() -> appointmentService.createAppointment(booking("10:00")))
                .isInstanceOf(AppointmentConflictException.class);
        verify(appointmentRepository).deleteById("b");
    }

    @Test
    void earlierOfTwoRacingBookingsSurvives() {
        stubLookups();
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(), List.of(existing("c", "10:00")));
        stubSaveAssigning("b");

        Appointment saved = appointmentService.createAppointment(booking("10:00"));

        assertThat(saved.getId()).isEqualTo("b");
        verify(appointmentRepository, never()).deleteById(any());
    }

    @Test
    void missingFieldsAreListed() {
        AppointmentRequest request = new AppointmentRequest("PAT123456789", null, DAY, null, null,
                null, null, " ", null, null, null);

        assertThatThrownBy(() -> appointmentService.createAppointment(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required fields: doctorId, appointmentTime, reason");
    }

    @Test
    void malformedTimeIsRejected() {
        assertThatThrownBy(() -> appointmentService.createAppointment(booking("25:00")))
                .hasMessage("Invalid time format. Use HH:MM (24-hour format)");
    }

    @Test
    void inactiveDoctorDoesNotTakeBookings() {
        stubLookups();
        doctor.setStatus(DoctorStatus.ON_LEAVE);

        assertThatThrownBy(() -> appointmentService.createAppointment(booking("10:00")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Doctor is not accepting appointments");
    }

    @Test
    void movingAnAppointmentIgnoresItself() {
        Appointment own = existing("x", "10:00");
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(own));
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(own));
        when(appointmentRepository.save(own)).thenReturn(own);

        Appointment updated = appointmentService.updateAppointment("x", new AppointmentUpdateRequest(
                null, "10:15", null, null, null, null, null, null, null, null, null, null, null, null));

        assertThat(updated.getAppointmentTime()).isEqualTo("10:15");
    }

    @Test
    void movingOntoAnotherAppointmentConflicts() {
        Appointment own = existing("x", "09:00");
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(own));
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(own, existing("y", "11:00")));

        assertThatThrownBy(() -> appointmentService.updateAppointment("x", new AppointmentUpdateRequest(
                null, "11:15", null, null, null, null, null, null, null, null, null, null, null, null)))
                .isInstanceOf(AppointmentConflictException.class);
    }

    @Test
    void completedAppointmentCannotBeCancelled() {
        Appointment done = existing("x", "09:00");
        done.setStatus(AppointmentStatus.COMPLETED);
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(done));

        assertThatThrownBy(() -> appointmentService.cancelAppointment("x", new CancellationRequest("busy", null), "patient"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot cancel a completed appointment");
    }

    @Test
    void cancellationRecordsReasonAndActor() {
        Appointment open = existing("x", "09:00");
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(open));
        when(appointmentRepository.save(open)).thenReturn(open);

        Appointment cancelled = appointmentService.cancelAppointment("x", new CancellationRequest(null, null), "patient");

        assertThat(cancelled.getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(cancelled.getCancellation().getReason()).isEqualTo("No reason provided");
        assertThat(cancelled.getCancellation().getCancelledBy()).isEqualTo("patient");
    }

    @Test
    void unknownAppointmentIsNotFound() {
        when(appointmentRepository.findById("nope")).thenReturn(Optional.empty());
        when(appointmentRepository.findByAppointmentId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> appointmentService.getAppointment("nope"))
                .isInstanceOf(java.util.NoSuchElementException.class)
                .hasMessage("Appointment not found");
    }

    @Test
    void rescheduleMovesTheSlotAndMarksIt() {
        Appointment own = existing("x", "09:00");
        LocalDate nextDay = DAY.plusDays(1);
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(own));
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", nextDay, AppointmentStatus.BLOCKING))
                .thenReturn(List.of());
        when(appointmentRepository.save(own)).thenReturn(own);

        Appointment moved = appointmentService.rescheduleAppointment("x", new RescheduleRequest(nextDay, "14:00", "Travel"));

        assertThat(moved.getAppointmentDate()).isEqualTo(nextDay);
        assertThat(moved.getAppointmentTime()).isEqualTo("14:00");
        assertThat(moved.getStatus()).isEqualTo(AppointmentStatus.RESCHEDULED);
        assertThat(moved.getNotes()).isEqualTo("Rescheduled: Travel");
    }

    @Test
    void rescheduleWithinOwnSlotIgnoresItself() {
        Appointment own = existing("x", "09:00");
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(own));
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(own));
        when(appointmentRepository.save(own)).thenReturn(own);

        Appointment moved = appointmentService.rescheduleAppointment("x", new RescheduleRequest(DAY, "09:15", null));

        assertThat(moved.getAppointmentTime()).isEqualTo("09:15");
    }

    @Test
    void rescheduleOntoAnotherBookingConflicts() {
        Appointment own = existing("x", "09:00");
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(own));
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", DAY, AppointmentStatus.BLOCKING))
                .thenReturn(List.of(own, existing("y", "11:00")));

        assertThatThrownBy(() -> appointmentService.rescheduleAppointment("x", new RescheduleRequest(DAY, "11:00", null)))
                .isInstanceOf(AppointmentConflictException.class);
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void closedAppointmentCannotBeRescheduled() {
        Appointment done = existing("x", "09:00");
        done.setStatus(AppointmentStatus.CANCELLED);
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(done));

        assertThatThrownBy(() -> appointmentService.rescheduleAppointment("x", new RescheduleRequest(DAY, "15:00", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot reschedule a cancelled appointment");
    }

    @Test
    void unknownStatusIsRejected() {
        assertThatThrownBy(() -> appointmentService.updateStatus("x", new StatusUpdateRequest("archived", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid status: archived");
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void timingFlagsFollowTheHospitalClock() {
        Appointment later = existing("x", "10:00");
        Appointment earlier = existing("y", "07:30");
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(later));
        when(appointmentRepository.findById("y")).thenReturn(Optional.of(earlier));

        assertThat(appointmentService.getAppointment("x").getUpcoming()).isTrue();
        assertThat(appointmentService.getAppointment("x").getPast()).isFalse();
        assertThat(appointmentService.getAppointment("y").getUpcoming()).isFalse();
        assertThat(appointmentService.getAppointment("y").getPast()).isTrue();
    }

    @Test
    void rescheduledAppointmentIsNotCountedAsUpcoming() {
        Appointment own = existing("x", "09:00");
        LocalDate nextDay = DAY.plusDays(1);
        when(appointmentRepository.findById("x")).thenReturn(Optional.of(own));
        when(appointmentRepository.findByDoctorAndAppointmentDateAndStatusIn("d-1", nextDay, AppointmentStatus.BLOCKING))
                .thenReturn(List.of());
        when(appointmentRepository.save(own)).thenReturn(own);

        Appointment moved = appointmentService.rescheduleAppointment("x", new RescheduleRequest(nextDay, "10:00", null));

        assertThat(moved.getUpcoming()).isFalse();
        assertThat(moved.getPast()).isFalse();
    }

    @Test
    void statsCountOnlyOpenFutureAppointmentsAsUpcoming() {
        when(appointmentRepository.count()).thenReturn(7L);
        when(appointmentRepository.countByAppointmentDate(DAY)).thenReturn(2L);
        when(appointmentRepository.countByStatus(any(AppointmentStatus.class))).thenReturn(1L);
        when(appointmentRepository.countByStatusInAndAppointmentDateGreaterThanEqual(
                EnumSet.of(AppointmentStatus.SCHEDULED, AppointmentStatus.CONFIRMED, AppointmentStatus.CHECKED_IN), DAY))
                .thenReturn(3L);

        AppointmentStats stats = appointmentService.getStats();

        assertThat(stats.total()).isEqualTo(7L);
        assertThat(stats.today()).isEqualTo(2L);
        assertThat(stats.upcoming()).isEqualTo(3L);
        assertThat(stats.statusBreakdown()).hasSize(AppointmentStatus.values().length)
                .containsEntry("rescheduled", 1L);
    }
}
