package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.TechniqueRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.TechniqueService;

@RestController
@RequestMapping("/techniques")
@Tag(name = "Technique", description = "API for technique (skill) management")
@AllArgsConstructor
public class TechniqueController {
    private final TechniqueService techniqueService;

    @GetMapping
    @Operation(summary = "Get active techniques", description = "Includes craft and category names and the number of artisans")
    public ResponseEntity<?> getTechniques() {
        return ResponseEntity.status(HttpStatus.OK).body(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved techniques")
                        .data(techniqueService.findAll())
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Create new technique")
    public ResponseEntity<?> createTechnique(@Valid @RequestBody TechniqueRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Technique created successfully")
                        .data(techniqueService.createTechnique(request))
                        .build()
        );
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update technique")
    public ResponseEntity<?> updateTechnique(@PathVariable Long id, @Valid @RequestBody TechniqueRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Technique updated successfully")
                        .data(techniqueService.updateTechnique(id, request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Deactivate technique", description = "Soft delete; artisans keep their reference")
    public ResponseEntity<?> deleteTechnique(@PathVariable Long id) {
        techniqueService.deactivateTechnique(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Technique deleted successfully")
                        .build()
        );
    }
}
