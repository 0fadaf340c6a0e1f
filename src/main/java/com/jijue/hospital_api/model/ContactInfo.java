package com.jijue.hospital_api.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Document("contactinfo")
public class ContactInfo {
    @Id
    private String id;
    private String phone;
    private String email;
    private String address;
    private String operatingHours;
    private String emergencyPhone;
    private String whatsapp;
    private String facebook;
    private String twitter;

    public static ContactInfo defaults() {
        return new ContactInfo(null,
                "+254115947353",
                "info@jijuehospital.com",
                "Health Street, Nairobi City, Kenya",
                "Mon-Fri: 8am-6pm, Sat: 9am-1pm, Sun: Emergency Only",
                "+254115947353",
                "+254115947353",
                "JijueHospital",
                "@JijueHospital");
    }
}
