package se.artisan_be.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Create and update body for chat sessions. {@code sessionId} is required on create and ignored on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionRequest {
    private String sessionId;
    private String chatTitle;
    private String description;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String userIp;
    private String userAgent;
    private String status;
    private String tags;
    private String notes;
}
