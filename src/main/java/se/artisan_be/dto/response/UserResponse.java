package se.artisan_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private Long id;
    private String username;
    private String roles;
    private String geoLevelCode;
    /** Name of the area behind {@code geoLevelCode}. */
    private String region;
    private Boolean isMobileUser;
    private Boolean isActive;
    private Long userId;
    private long numberOfArtisans;
    private LocalDateTime createdAt;
}
