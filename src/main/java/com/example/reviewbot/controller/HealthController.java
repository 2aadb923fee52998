package com.example.reviewbot.controller;

import com.example.reviewbot.kv.KvClient;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the two stores the conversation engine cannot work without.
 * Answers 503 when either is down.
 */
@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final KvClient kvClient;
    private final MongoTemplate mongo;

    public HealthController(KvClient kvClient, MongoTemplate mongo) {
        this.kvClient = kvClient;
        this.mongo = mongo;
    }

    @GetMapping({"/health", "/actuator/health"})
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "course-review-bot");
        boolean sessionsUp = probe("sessions", () -> kvClient.get("health-check"), body);
        boolean recordsUp = probe("records", () -> mongo.executeCommand(new Document("ping", 1)), body);
        boolean up = sessionsUp && recordsUp;
        body.put("status", up ? "UP" : "DOWN");
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static boolean probe(String name, Runnable check, Map<String, Object> body) {
        try {
            check.run();
            body.put(name, "UP");
            return true;
        } catch (RuntimeException e) {
            logger.warn("Health probe {} failed: {}", name, e.getMessage());
            body.put(name, "DOWN");
            body.put(name + "Error", e.getMessage());
            return false;
        }
    }
}
