package se.artisan_be.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {

    @Size(min = 3, max = 100)
    private String username;

    private String roles;

    private String geoLevelCode;

    private Boolean isMobileUser;

    private Boolean isActive;

    private Long userId;
}
