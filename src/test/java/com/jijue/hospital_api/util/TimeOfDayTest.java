package com.jijue.hospital_api.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeOfDayTest {

    @Test
    void parsesAndFormatsMinutes() {
        assertThat(TimeOfDay.toMinutes("09:30")).isEqualTo(570);
        assertThat(TimeOfDay.toMinutes("9:05")).isEqualTo(545);
        assertThat(TimeOfDay.fromMinutes(545)).isEqualTo("09:05");
        assertThat(TimeOfDay.normalize("7:00")).isEqualTo("07:00");
    }

    @Test
    void rejectsMalformedTimes() {
        assertThat(TimeOfDay.isValid("24:00")).isFalse();
        assertThat(TimeOfDay.isValid("12:60")).isFalse();
        assertThat(TimeOfDay.isValid("noon")).isFalse();
        assertThat(TimeOfDay.isValid(null)).isFalse();
        assertThatThrownBy(() -> TimeOfDay.toMinutes("25:00"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rendersTwelveHourClock() {
        assertThat(TimeOfDay.toDisplay("00:15")).isEqualTo("12:15 AM");
        assertThat(TimeOfDay.toDisplay("12:00")).isEqualTo("12:00 PM");
        assertThat(TimeOfDay.toDisplay("13:30")).isEqualTo("1:30 PM");
    }
}
