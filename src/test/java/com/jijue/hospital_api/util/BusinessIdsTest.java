package com.jijue.hospital_api.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BusinessIdsTest {

    @Test
    void patientAndAppointmentCodesUseTimestampTail() {
        assertThat(BusinessIds.patientId(1718000123456L)).matches("PAT123456\\d{3}");
        assertThat(BusinessIds.appointmentId(1718000123456L)).matches("APT123456\\d{3}");
    }

    @Test
    void doctorCodeEndsWithFourAlphanumerics() {
        assertThat(BusinessIds.doctorId(1718000123456L)).matches("DOC00123456[A-Z0-9]{4}");
    }

    @Test
    void departmentCodeIsInitialsPlusFourDigits() {
        assertThat(BusinessIds.departmentCode("general surgery  unit", 1718000001234L)).isEqualTo("GSU1234");
    }
}
