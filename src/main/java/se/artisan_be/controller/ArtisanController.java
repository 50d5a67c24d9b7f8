package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import se.artisan_be.dto.UploadedFile;
import se.artisan_be.dto.request.ArtisanCreateRequest;
import se.artisan_be.dto.request.ArtisanUpdateRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.dto.response.ProgressFrame;
import se.artisan_be.service.ArtisanService;
import se.artisan_be.service.ArtisanService.ArtisanWriteResult;
import se.artisan_be.service.FileStorageService;
import se.artisan_be.streaming.ProgressStreamRunner;
import se.artisan_be.util.ArtisanFormReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/artisans")
@Tag(name = "Artisan", description = "API for artisan registration and profiles")
@AllArgsConstructor
public class ArtisanController {
    private final ArtisanService artisanService;
    private final FileStorageService fileStorageService;
    private final ProgressStreamRunner progressStreamRunner;
    private final ArtisanFormReader artisanFormReader;

    @GetMapping
    @Operation(summary = "Get active artisans", description = "Accepts the same filters as the chart endpoints, e.g. user_id, tehsil, skill")
    public ResponseEntity<?> getArtisans(@RequestParam Map<String, String> filters) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved artisans")
                        .data(artisanService.getAll(filters))
                        .build()
        );
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get artisan by ID", description = "Includes trainings, loans, machines and images")
    public ResponseEntity<?> getArtisanById(@PathVariable Long id,
                                            @RequestParam(defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved artisan")
                        .data(artisanService.getOne(id, includeInactive))
                        .build()
        );
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Create artisan (multipart)",
            description = "Sections are JSON strings; images go in profile_picture, product_images and shop_images. Streams progress as server-sent events")
    public SseEmitter createArtisanWithUploads(
            @RequestParam("artisan") String artisan,
            @RequestParam(value = "trainings", required = false) String trainings,
            @RequestParam(value = "loans", required = false) String loans,
            @RequestParam(value = "machines", required = false) String machines,
            @RequestPart(value = "profile_picture", required = false) MultipartFile profilePicture,
            @RequestPart(value = "product_images", required = false) List<MultipartFile> productImages,
            @RequestPart(value = "shop_images", required = false) List<MultipartFile> shopImages) {
        ArtisanCreateRequest request = artisanFormReader.read(artisan, trainings, loans, machines);

        UploadedFile stagedProfile = profilePicture == null || profilePicture.isEmpty()
                ? null : fileStorageService.stage(profilePicture);
        List<UploadedFile> stagedProducts = stageAll(productImages);
        List<UploadedFile> stagedShops = stageAll(shopImages);

        return progressStreamRunner.stream("Create artisan",
                listener -> created(artisanService.create(request, stagedProfile, stagedProducts, stagedShops, listener)),
                () -> artisanService.discardStaged(stagedProfile, stagedProducts, stagedShops));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create artisan", description = "Streams progress as server-sent events")
    public SseEmitter createArtisan(@Valid @RequestBody ArtisanCreateRequest request) {
        return progressStreamRunner.stream("Create artisan", listener -> created(
                artisanService.create(request, null, Collections.emptyList(), Collections.emptyList(), listener)));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update artisan",
            description = "Overwrites the supplied sections in one transaction. Streams progress as server-sent events")
    public SseEmitter updateArtisan(@PathVariable Long id, @Valid @RequestBody ArtisanUpdateRequest request) {
        return progressStreamRunner.stream("Update artisan " + id, listener -> {
            ArtisanWriteResult result = artisanService.update(id, request, listener);
            return ProgressFrame.builder()
                    .status(ProgressFrame.COMPLETE)
                    .statusCode(HttpStatus.OK.value())
                    .id(result.id())
                    .message("Artisan and related data updated successfully")
                    .build();
        });
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete artisan", description = "Soft delete; the record stays readable with includeInactive=true")
    public ResponseEntity<?> deleteArtisan(@PathVariable Long id) {
        artisanService.softDelete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Artisan deleted successfully")
                        .data(null)
                        .build()
        );
    }

    private List<UploadedFile> stageAll(List<MultipartFile> files) {
        List<UploadedFile> staged = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                if (!file.isEmpty()) {
                    staged.add(fileStorageService.stage(file));
                }
            }
        }
        return staged;
    }

    private static ProgressFrame created(ArtisanWriteResult result) {
        return ProgressFrame.builder()
                .status(ProgressFrame.COMPLETE)
                .statusCode(HttpStatus.CREATED.value())
                .id(result.id())
                .message("Artisan and related data created successfully")
                .imagePaths(result.imagePaths())
                .shopImagePaths(result.shopImagePaths())
                .build();
    }
}
