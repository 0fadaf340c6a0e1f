package com.jijue.hospital_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import com.jijue.hospital_api.service.UserService;

/**
 * Creates the first administrator from {@code app.admin.email} /
 * {@code app.admin.password} when both are set and the account is missing.
 */
@Component
public class AdminAccountInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final UserService userService;

    @Value("${app.admin.email:}")
    private String adminEmail;

    @Value("${app.admin.password:}")
    private String adminPassword;

    public AdminAccountInitializer(UserService userService) {
        this.userService = userService;
    }

    @Override
    public void run(String... args) {
        if (adminEmail == null || adminEmail.isBlank() || adminPassword == null || adminPassword.isBlank()) {
            logger.info("No bootstrap administrator configured (app.admin.email / app.admin.password).");
            return;
        }
        try {
            boolean created = userService.ensureAdmin(adminEmail, adminPassword);
            if (created) {
                logger.info("Bootstrap administrator {} created.", adminEmail);
            } else {
                logger.info("Bootstrap administrator {} already exists.", adminEmail);
            }
        } catch (IllegalArgumentException e) {
            logger.error("Could not create bootstrap administrator {}: {}", adminEmail, e.getMessage());
        }
    }
}
