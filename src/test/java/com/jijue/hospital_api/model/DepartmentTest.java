package com.jijue.hospital_api.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;

class DepartmentTest {

    @Test
    void prepareForSaveGeneratesCodeAndSyncsServices() {
        Department department = new Department("General Surgery Unit", "Theatre and wards");
        ServiceOffering service = new ServiceOffering();
        service.setName("Appendectomy");
        department.setServices(List.of(service));

        department.prepareForSave(1718000001234L);

        assertThat(department.getDepartmentCode()).isEqualTo("GSU1234");
        assertThat(department.getServiceList()).containsExactly("Appendectomy");
    }

    @Test
    void closedStatusForcesInactive() {
        Department department = new Department("Radiology", null);
        department.setStatus(DepartmentStatus.CLOSED);
        department.prepareForSave(1L);
        assertThat(department.isActive()).isFalse();

        Department switchedOff = new Department("Pharmacy", null);
        switchedOff.setActive(false);
        switchedOff.prepareForSave(1L);
        assertThat(switchedOff.getStatus()).isEqualTo(DepartmentStatus.INACTIVE);
        assertThat(switchedOff.getCurrentStatus()).isEqualTo("Closed");
    }

    @Test
    void formattedHoursMentionsEmergencyCover() {
        Department department = new Department("Emergency", null);
        assertThat(department.getFormattedHours())
                .isEqualTo("Weekdays: 08:00 - 17:00 | Weekends: 09:00 - 13:00 | 24/7 Emergency");
    }

    @Test
    void openingFollowsWeekdayAndWeekendWindows() {
        Department department = new Department("Dental", null);
        department.getOperatingHours().setEmergency(false);

        assertThat(department.isOpenAt(LocalDateTime.of(2024, 6, 10, 10, 0))).isTrue();
        assertThat(department.isOpenAt(LocalDateTime.of(2024, 6, 10, 18, 0))).isFalse();
        assertThat(department.isOpenAt(LocalDateTime.of(2024, 6, 15, 12, 0))).isTrue();
        assertThat(department.isOpenAt(LocalDateTime.of(2024, 6, 15, 14, 0))).isFalse();

        department.getOperatingHours().setEmergency(true);
        assertThat(department.isOpenAt(LocalDateTime.of(2024, 6, 15, 23, 0))).isTrue();
        department.setActive(false);
        assertThat(department.isOpenAt(LocalDateTime.of(2024, 6, 15, 23, 0))).isFalse();
    }
}
