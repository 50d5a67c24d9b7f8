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
public class TechniqueRequest {

    @NotBlank
    private String name;

    private Long categoryId;

    @Size(max = 32)
    private String color;

    private Boolean isActive;
}
