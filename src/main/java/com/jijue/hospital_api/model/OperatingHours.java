package com.jijue.hospital_api.model;

import com.jijue.hospital_api.util.TimeOfDay;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class OperatingHours {
    private Window weekdays = new Window("08:00", "17:00");
    private Window weekends = new Window("09:00", "13:00");
    private boolean emergency = true;
    private String notes;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Window {
        private String open;
        private String close;

        public boolean contains(int minutes) {
            if (open == null || close == null) {
                return false;
            }
            return minutes >= TimeOfDay.toMinutes(open) && minutes <= TimeOfDay.toMinutes(close);
        }

        @Override
        public String toString() {
            return open + " - " + close;
        }
    }
}
