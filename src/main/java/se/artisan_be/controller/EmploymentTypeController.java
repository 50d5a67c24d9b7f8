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
import se.artisan_be.service.EmploymentTypeService;

@RestController
@RequestMapping("/employment-types")
@Tag(name = "EmploymentType", description = "API for employment type lookup values")
@AllArgsConstructor
public class EmploymentTypeController {
    private final EmploymentTypeService employmentTypeService;

    @GetMapping
    @Operation(summary = "Get all employment types")
    public ResponseEntity<?> getAll() {
        return ResponseEntity.status(HttpStatus.OK).body(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved employment types")
                        .data(employmentTypeService.findAll())
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Create employment type")
    public ResponseEntity<?> create(@Valid @RequestBody LookupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Employment type created successfully")
                        .data(employmentTypeService.create(request))
                        .build()
        );
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update employment type")
    public ResponseEntity<?> update(@PathVariable Long id, @Valid @RequestBody LookupRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Employment type updated successfully")
                        .data(employmentTypeService.update(id, request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete employment type")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        employmentTypeService.delete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Employment type deleted successfully")
                        .build()
        );
    }
}
