package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.LookupRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.EducationService;

@RestController
@RequestMapping("/education")
@Tag(name = "Education", description = "API for education level lookup values")
@AllArgsConstructor
public class EducationController {
    private final EducationService educationService;

    @GetMapping
    @Operation(summary = "Get all education levels")
    public ResponseEntity<?> getAll() {
        return ResponseEntity.status(HttpStatus.OK).body(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved education levels")
                        .data(educationService.findAll())
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Create education level")
    public ResponseEntity<?> create(@Valid @RequestBody LookupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Education created successfully")
                        .data(educationService.create(request))
                        .build()
        );
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update education level")
    public ResponseEntity<?> update(@PathVariable Long id, @Valid @RequestBody LookupRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Education updated successfully")
                        .data(educationService.update(id, request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete education level")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        educationService.delete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Education deleted successfully")
                        .build()
        );
    }
}
