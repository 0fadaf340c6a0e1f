package com.jijue.hospital_api.controller;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.mongodb.MongoException;

/**
 * Liveness endpoint, also reports whether MongoDB answers a ping.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Value("${app.environment:development}")
    private String environment;

    public HealthController(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> database = new LinkedHashMap<>();
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
            database.put("connected", true);
            database.put("name", mongoTemplate.getDb().getName());
        } catch (DataAccessException | MongoException e) {
            logger.error("MongoDB health check failed: {}", e.getMessage());
            database.put("connected", false);
            database.put("name", null);
        }

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("success", true);
        health.put("message", "Jijue Hospital API is running");
        health.put("timestamp", clock.instant().toString());
        health.put("environment", environment);
        health.put("version", "1.0.0");
        health.put("database", database);
        return ResponseEntity.ok(health);
    }
}
