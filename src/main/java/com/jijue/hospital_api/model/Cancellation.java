package com.jijue.hospital_api.model;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Cancellation {
    private String reason;
    private String cancelledBy;
    private Instant cancelledAt;
}
