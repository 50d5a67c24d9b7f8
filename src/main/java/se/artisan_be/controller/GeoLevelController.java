package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.GeoLevelRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.GeoLevelService;

@RestController
@RequestMapping("/geo_level")
@Tag(name = "GeoLevel", description = "Divisions, districts and tehsils")
@AllArgsConstructor
public class GeoLevelController {
    private final GeoLevelService geoLevelService;

    @GetMapping
    @Operation(summary = "Get areas", description = "code_length=3 for divisions, 6 for districts, 9 for tehsils")
    public ResponseEntity<?> getGeoLevels(@RequestParam(value = "code_length", required = false) Integer codeLength) {
        return ResponseEntity.status(HttpStatus.OK).body(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved geo levels")
                        .data(geoLevelService.findAll(codeLength))
                        .build()
        );
    }

    @GetMapping("/{code}/children")
    @Operation(summary = "Get child areas", description = "Districts of a division or tehsils of a district")
    public ResponseEntity<?> getChildren(@PathVariable String code) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved geo levels")
                        .data(geoLevelService.findChildren(code))
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Create area")
    public ResponseEntity<?> createGeoLevel(@Valid @RequestBody GeoLevelRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Geo level created successfully")
                        .data(geoLevelService.create(request))
                        .build()
        );
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update area")
    public ResponseEntity<?> updateGeoLevel(@PathVariable Long id, @Valid @RequestBody GeoLevelRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Geo level updated successfully")
                        .data(geoLevelService.update(id, request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete area")
    public ResponseEntity<?> deleteGeoLevel(@PathVariable Long id) {
        geoLevelService.delete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Geo level deleted successfully")
                        .build()
        );
    }
}
