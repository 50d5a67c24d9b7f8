package se.artisan_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRegisterRequest {

    @NotBlank
    @Size(min = 3, max = 100)
    private String username;

    private String roles;

    private String geoLevelCode;

    private Boolean isMobileUser;

    /** Id of the user performing the registration. */
    private Long userId;
}
