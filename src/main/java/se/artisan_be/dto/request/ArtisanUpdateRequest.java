package se.artisan_be.dto.request;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sections to overwrite. A null section is left untouched; a present list (even empty)
 * replaces every existing child row of that kind.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtisanUpdateRequest {

    @Valid
    private ArtisanDetailsRequest artisan;

    @Valid
    private List<TrainingRequest> trainings;

    @Valid
    private List<LoanRequest> loans;

    @Valid
    private List<MachineRequest> machines;
}
