package com.jijue.hospital_api.dto;

import com.jijue.hospital_api.model.Doctor;

public record DoctorBrief(String id, String doctorId, String name, String specialization, String specialtyDisplay) {

    public static DoctorBrief of(Doctor doctor) {
        return new DoctorBrief(doctor.getId(), doctor.getDoctorId(), doctor.getName(),
                doctor.getSpecialization() == null ? null : doctor.getSpecialization().getValue(),
                doctor.getSpecialtyDisplay());
    }

    /** Placeholder used when the referenced doctor record no longer exists. */
    public static DoctorBrief unknown() {
        return new DoctorBrief(null, null, "Doctor", "general-medicine", "General Medicine");
    }
}
