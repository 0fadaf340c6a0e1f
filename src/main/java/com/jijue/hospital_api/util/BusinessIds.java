package com.jijue.hospital_api.util;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Human-readable identifiers shown to patients and staff. Mongo ids stay the
 * primary keys; these codes carry unique indexes of their own.
 */
public final class BusinessIds {

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private BusinessIds() {
    }

    public static String patientId(long epochMillis) {
        return "PAT" + lastDigits(epochMillis, 6) + randomDigits(3);
    }

    public static String doctorId(long epochMillis) {
        StringBuilder suffix = new StringBuilder();
        for (int i = 0; i < 4; i++) {
            suffix.append(ALPHANUMERIC.charAt(ThreadLocalRandom.current().nextInt(ALPHANUMERIC.length())));
        }
        return "DOC" + lastDigits(epochMillis, 8) + suffix;
    }

    public static String appointmentId(long epochMillis) {
        return "APT" + lastDigits(epochMillis, 6) + randomDigits(3);
    }

    /** Initials of each word of the name, uppercased, followed by the last four digits of the timestamp. */
    public static String departmentCode(String name, long epochMillis) {
        String initials = Arrays.stream(Objects.requireNonNullElse(name, "").trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1))
                .collect(Collectors.joining())
                .toUpperCase();
        return initials + lastDigits(epochMillis, 4);
    }

    private static String lastDigits(long value, int count) {
        String digits = Long.toString(Math.abs(value));
        if (digits.length() < count) {
            digits = "0".repeat(count - digits.length()) + digits;
        }
        return digits.substring(digits.length() - count);
    }

    private static String randomDigits(int count) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < count; i++) {
            builder.append(ThreadLocalRandom.current().nextInt(10));
        }
        return builder.toString();
    }
}
