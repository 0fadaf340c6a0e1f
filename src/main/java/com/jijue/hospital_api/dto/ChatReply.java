package com.jijue.hospital_api.dto;

import java.time.Instant;

public record ChatReply(String response, Instant timestamp) {
}
