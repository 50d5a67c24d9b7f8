package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.CraftRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.CraftService;

@RestController
@RequestMapping("/crafts")
@Tag(name = "Craft", description = "API for craft management")
@AllArgsConstructor
public class CraftController {
    private final CraftService craftService;

    @GetMapping
    @Operation(summary = "Get all crafts", description = "Each craft carries its category, technique and artisan counts")
    public ResponseEntity<?> getCrafts() {
        return ResponseEntity.status(HttpStatus.OK).body(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved crafts")
                        .data(craftService.findAll())
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Create new craft")
    public ResponseEntity<?> createCraft(@Valid @RequestBody CraftRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Craft created successfully")
                        .data(craftService.createCraft(request))
                        .build()
        );
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update craft")
    public ResponseEntity<?> updateCraft(@PathVariable Long id, @Valid @RequestBody CraftRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Craft updated successfully")
                        .data(craftService.updateCraft(id, request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete craft")
    public ResponseEntity<?> deleteCraft(@PathVariable Long id) {
        craftService.deleteCraft(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Craft deleted successfully")
                        .build()
        );
    }
}
