package se.artisan_be.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtisanCreateRequest {

    @Valid
    @NotNull(message = "Artisan details are required")
    private ArtisanDetailsRequest artisan;

    @Valid
    @Builder.Default
    private List<TrainingRequest> trainings = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<LoanRequest> loans = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<MachineRequest> machines = new ArrayList<>();
}
