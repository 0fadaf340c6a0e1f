package com.jijue.hospital_api.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.Data;
import lombok.NoArgsConstructor;

/** Entry of the public catalog of treatments and procedures. */
@Data
@NoArgsConstructor
@Document("services")
public class HospitalService {
    @Id
    private String id;
    private String name;
    private String category;
    private String description;
    private String detailedDescription;
    private String duration;
    private String price;
    private int specialistsCount = 1;
    private String successRate = "95%";
    private List<String> features = new ArrayList<>();
    private String icon = "🏥";
    private List<Procedure> procedures = new ArrayList<>();
    private List<String> requirements = new ArrayList<>();
    private List<String> images = new ArrayList<>();
    private String consultationFee = "Free Consultation";
    private boolean insuranceCovered = true;
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;

    @Data
    @NoArgsConstructor
    public static class Procedure {
        private int step;
        private String title;
        private String description;
        private String duration;
    }
}
