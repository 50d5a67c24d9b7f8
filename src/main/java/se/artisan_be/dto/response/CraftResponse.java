package se.artisan_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CraftResponse {
    private Long id;
    private String name;
    private Boolean isActive;
    private long numberOfCategories;
    private long numberOfTechniques;
    private long numberOfArtisans;
}
