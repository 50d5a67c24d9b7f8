package se.artisan_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechniqueResponse {
    private Long id;
    private String name;
    private String color;
    private Long categoryId;
    private String categoryName;
    private Long craftId;
    private String craftName;
    private Boolean isActive;
    private long numberOfArtisans;
}
