package se.artisan_be.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.repository.jdbc.SqlClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private SqlClient sqlClient;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void health_databaseAnswers_isUp() {
        // Arrange
        when(sqlClient.queryOne(anyString())).thenReturn(Optional.of(Map.of("ok", 1)));
        HealthController controller = new HealthController(sqlClient, clock);

        // Act
        ResponseEntity<?> response = controller.health();

        // Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<?, ?> data = (Map<?, ?>) ((ObjectResponse) response.getBody()).getData();
        assertEquals("UP", data.get("database"));
    }

    @Test
    void health_databaseDown_isServiceUnavailable() {
        // Arrange
        when(sqlClient.queryOne(anyString())).thenThrow(new DataAccessResourceFailureException("connection refused"));
        HealthController controller = new HealthController(sqlClient, clock);

        // Act
        ResponseEntity<?> response = controller.health();

        // Assert
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        Map<?, ?> data = (Map<?, ?>) ((ObjectResponse) response.getBody()).getData();
        assertEquals("DOWN", data.get("database"));
    }
}
