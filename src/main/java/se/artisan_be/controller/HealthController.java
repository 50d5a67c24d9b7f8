package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.repository.jdbc.SqlClient;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Health")
@AllArgsConstructor
@Slf4j
public class HealthController {
    private final SqlClient sqlClient;
    private final Clock clock;

    @GetMapping("/health")
    @Operation(summary = "Liveness and database check", description = "503 when the database does not answer")
    public ResponseEntity<?> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", LocalDateTime.now(clock));
        try {
            sqlClient.queryOne("SELECT 1 AS ok");
        } catch (DataAccessException e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            data.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                    ObjectResponse.builder()
                            .status(HttpStatus.SERVICE_UNAVAILABLE.toString())
                            .message("Service is unhealthy")
                            .data(data)
                            .build()
            );
        }
        data.put("database", "UP");
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Service is healthy")
                        .data(data)
                        .build()
        );
    }
}
