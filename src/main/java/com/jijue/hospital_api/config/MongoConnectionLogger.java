package com.jijue.hospital_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.Department;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.Patient;

/**
 * Logs MongoDB connection status and collection sizes on application startup
 */
@Component
public class MongoConnectionLogger implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(MongoConnectionLogger.class);

    private final MongoTemplate mongoTemplate;

    @Value("${spring.data.mongodb.uri:not-set}")
    private String mongoUri;

    public MongoConnectionLogger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void run(String... args) {
        logger.info("=== MONGODB CONNECTION CHECK ===");
        logger.info("MongoDB URI: {} (masked)", mask(mongoUri));

        try {
            String dbName = mongoTemplate.getDb().getName();
            logger.info("✓ Connected to database: {}", dbName);
            logger.info("✓ patients={}, doctors={}, departments={}, appointments={}",
                    mongoTemplate.estimatedCount(Patient.class),
                    mongoTemplate.estimatedCount(Doctor.class),
                    mongoTemplate.estimatedCount(Department.class),
                    mongoTemplate.estimatedCount(Appointment.class));
            logger.info("=== MONGODB CONNECTION: OK ===");
        } catch (Exception e) {
            logger.error("✗ MongoDB connection failed!");
            logger.error("✗ Error: {}", e.getMessage(), e);
            logger.error("=== MONGODB CONNECTION: FAILED ===");
        }
    }

    static String mask(String uri) {
        return uri.replaceAll(":[^:@/]+@", ":****@");
    }
}
