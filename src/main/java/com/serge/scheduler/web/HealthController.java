package com.serge.scheduler.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** Liveness probe; does not touch the database. */
@RestController
public class HealthController {

    @GetMapping("/")
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", "meeting-scheduler-server");
        return body;
    }
}
