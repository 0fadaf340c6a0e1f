package com.jijue.hospital_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Reports on the configured JWT secret at startup. The signing key is derived
 * from a SHA-256 digest of the secret, so any string works; short or default
 * secrets are only flagged.
 */
@Component
public class JwtSecretValidator implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(JwtSecretValidator.class);

    static final String DEVELOPMENT_SECRET = "jijue-hospital-development-secret-change-me";

    @Value("${jwt.secret:not-set}")
    private String jwtSecret;

    @Value("${app.environment:development}")
    private String environment;

    @Override
    public void run(String... args) {
        logger.info("=== JWT SECRET VALIDATION ===");

        if (jwtSecret == null || jwtSecret.isBlank() || "not-set".equals(jwtSecret)) {
            logger.error("✗ JWT Secret is not configured!");
            logger.error("✗ Set the JWT_SECRET environment variable.");
            logger.error("=== JWT SECRET VALIDATION: FAILED ===");
            return;
        }

        String masked = jwtSecret.length() > 10
            ? jwtSecret.substring(0, 5) + "..." + jwtSecret.substring(jwtSecret.length() - 5)
            : "****";
        logger.info("JWT Secret length: {}, masked: {}", jwtSecret.length(), masked);

        if (DEVELOPMENT_SECRET.equals(jwtSecret)) {
            if ("production".equalsIgnoreCase(environment)) {
                logger.error("✗ The development JWT secret is in use in production!");
                logger.error("=== JWT SECRET VALIDATION: FAILED ===");
                return;
            }
            logger.warn("! Using the development JWT secret ({} environment).", environment);
        }

        if (jwtSecret.length() < 16) {
            logger.warn("! JWT Secret is short ({} characters). Use at least 16.", jwtSecret.length());
        }
        logger.info("=== JWT SECRET VALIDATION: OK ===");
    }
}
