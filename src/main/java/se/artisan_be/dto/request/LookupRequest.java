package se.artisan_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body for the flat name-only lookups (education levels, employment types).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LookupRequest {

    @NotBlank
    private String name;

    private Boolean isActive;
}
