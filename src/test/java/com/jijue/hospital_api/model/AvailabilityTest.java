package com.jijue.hospital_api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class AvailabilityTest {

    @Test
    void normalizesDaysAndTimes() {
        Availability availability = new Availability();
        availability.setWorkingDays(List.of("Monday", " tuesday", "monday"));
        availability.setStartTime("8:00");
        availability.setEndTime("12:00");
        availability.setBreakStart(null);
        availability.setBreakEnd(null);

        availability.normalizeAndValidate();

        assertThat(availability.getWorkingDays()).containsExactly("monday", "tuesday");
        assertThat(availability.getStartTime()).isEqualTo("08:00");
        assertThat(availability.slotStarts()).hasSize(8).first().isEqualTo("08:00");
    }

    @Test
    void rejectsInconsistentSchedules() {
        Availability reversed = new Availability();
        reversed.setStartTime("17:00");
        reversed.setEndTime("09:00");
        assertThatThrownBy(reversed::normalizeAndValidate).hasMessage("Start time must be before end time");

        Availability halfBreak = new Availability();
        halfBreak.setBreakEnd(null);
        assertThatThrownBy(halfBreak::normalizeAndValidate)
                .hasMessage("Break start and end must be provided together");

        Availability oddSlot = new Availability();
        oddSlot.setSlotDuration(25);
        assertThatThrownBy(oddSlot::normalizeAndValidate).isInstanceOf(IllegalArgumentException.class);

        Availability badDay = new Availability();
        badDay.setWorkingDays(List.of("funday"));
        assertThatThrownBy(badDay::normalizeAndValidate).hasMessage("Invalid working day: funday");
    }
}
