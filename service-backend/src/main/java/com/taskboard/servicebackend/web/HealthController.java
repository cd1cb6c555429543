package com.taskboard.servicebackend.web;

import com.taskboard.servicebackend.web.dto.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public liveness check and API descriptor.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final Clock clock;
    private final String version;

    public HealthController(Clock clock, @Value("${app.version:1.0.0}") String version) {
        this.clock = clock;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        Duration uptime = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "UP");
        data.put("timestamp", clock.instant().toString());
        data.put("version", version);
        data.put("uptimeSeconds", uptime.toSeconds());
        return ResponseEntity.ok(ApiResponse.ok("Service is running", data));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> describe() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "Taskboard API");
        data.put("version", version);
        data.put("endpoints", Map.of(
                "auth", Map.of(
                        "register", "POST /api/auth/register",
                        "login", "POST /api/auth/login",
                        "profile", "GET|PUT /api/auth/profile",
                        "changePassword", "PUT /api/auth/change-password",
                        "validateToken", "POST /api/auth/validate-token",
                        "logout", "POST /api/auth/logout"),
                "tasks", Map.of(
                        "list", "GET /api/tasks",
                        "create", "POST /api/tasks",
                        "item", "GET|PUT|DELETE /api/tasks/{id}",
                        "toggle", "PATCH /api/tasks/{id}/toggle",
                        "stats", "GET /api/tasks/stats",
                        "deleteCompleted", "DELETE /api/tasks/completed",
                        "markAllCompleted", "PUT /api/tasks/mark-all-completed"),
                "health", "GET /api/health"));
        return ResponseEntity.ok(ApiResponse.ok("Taskboard API", data));
    }
}
