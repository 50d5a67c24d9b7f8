package se.artisan_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoLevelRequest {

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9]{3}|[A-Za-z0-9]{6}|[A-Za-z0-9]{9}", message = "Code must be 3, 6 or 9 characters")
    private String code;

    @NotBlank
    private String name;
}
