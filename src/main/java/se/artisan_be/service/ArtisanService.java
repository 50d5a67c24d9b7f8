package se.artisan_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import se.artisan_be.dto.UploadedFile;
import se.artisan_be.dto.request.ArtisanCreateRequest;
import se.artisan_be.dto.request.ArtisanDetailsRequest;
import se.artisan_be.dto.request.ArtisanUpdateRequest;
import se.artisan_be.dto.response.ArtisanResponse;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.mapper.ArtisanMapper;
import se.artisan_be.repository.ArtisanRepository;
import se.artisan_be.repository.jdbc.SqlClient;
import se.artisan_be.streaming.ProgressListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ArtisanService {

    private final ArtisanRepository artisanRepository;
    private final ArtisanMapper artisanMapper;
    private final FileStorageService fileStorageService;
    private final SqlClient sqlClient;

    public ArtisanService(ArtisanRepository artisanRepository,
                          ArtisanMapper artisanMapper,
                          FileStorageService fileStorageService,
                          SqlClient sqlClient) {
        this.artisanRepository = artisanRepository;
        this.artisanMapper = artisanMapper;
        this.fileStorageService = fileStorageService;
        this.sqlClient = sqlClient;
    }

    public List<ArtisanResponse> getAll(Map<String, String> filters) {
        log.info("Fetching active artisans with filters {}", filters);
        return artisanRepository.findActive(filters).stream()
                .map(artisanMapper::toResponse)
                .toList();
    }

    public ArtisanResponse getOne(Long id, boolean includeInactive) {
        ArtisanResponse artisan = artisanMapper.toDetail(artisanRepository.findDetailRows(id, includeInactive));
        if (artisan == null) {
            throw new ResourceNotFoundException("Artisan", id);
        }
        return artisan;
    }

    /**
     * Inserts the artisan, then each child batch in turn. A failing batch leaves the earlier ones
     * in place. Staged uploads that were not moved are removed either way, and a profile picture
     * stored for an artisan row that failed to insert is deleted.
     */
    public ArtisanWriteResult create(ArtisanCreateRequest request,
                                     UploadedFile profilePicture,
                                     List<UploadedFile> productImages,
                                     List<UploadedFile> shopImages,
                                     ProgressListener listener) {
        ArtisanDetailsRequest details = request.getArtisan();
        try {
            listener.progress("Creating artisan...");
            String profilePath = profilePicture == null ? null
                    : fileStorageService.store(profilePicture, FileStorageService.PROFILE_PICTURES, "profile_picture");
            Long artisanId;
            try {
                artisanId = artisanRepository.insertArtisan(details, profilePath);
            } catch (RuntimeException e) {
                if (profilePath != null) {
                    fileStorageService.remove(profilePath);
                }
                throw e;
            }
            log.info("Artisan {} created", artisanId);

            listener.progress("Creating trainings...");
            artisanRepository.insertTrainings(artisanId, orEmpty(request.getTrainings()), details.getUserId());

            listener.progress("Creating loans...");
            artisanRepository.insertLoans(artisanId, orEmpty(request.getLoans()), details.getUserId());

            listener.progress("Creating machines...");
            artisanRepository.insertMachines(artisanId, orEmpty(request.getMachines()), details.getUserId());

            listener.progress("Creating product images...");
            List<String> imagePaths = storeAll(productImages, FileStorageService.PRODUCT_IMAGES, "product_image");
            artisanRepository.insertImages(ArtisanRepository.PRODUCT_IMAGES_TABLE, artisanId, imagePaths);

            listener.progress("Creating shop images...");
            List<String> shopImagePaths = storeAll(shopImages, FileStorageService.SHOP_IMAGES, "shop_image");
            artisanRepository.insertImages(ArtisanRepository.SHOP_IMAGES_TABLE, artisanId, shopImagePaths);

            return new ArtisanWriteResult(artisanId, imagePaths, shopImagePaths);
        } finally {
            discardStaged(profilePicture, productImages, shopImages);
        }
    }

    /**
     * Applies every supplied section in one transaction. Zero matching active rows rolls the whole
     * update back with a not-found error.
     */
    public ArtisanWriteResult update(Long id, ArtisanUpdateRequest request, ProgressListener listener) {
        return sqlClient.inTransaction(() -> {
            listener.progress("Updating artisan...");
            ArtisanDetailsRequest details = request.getArtisan();
            int updated = details != null
                    ? artisanRepository.updateArtisan(id, details, null)
                    : artisanRepository.touch(id);
            if (updated == 0) {
                throw new ResourceNotFoundException("Artisan", id);
            }
            Long userId = details == null ? null : details.getUserId();

            if (request.getTrainings() != null) {
                listener.progress("Updating trainings...");
                artisanRepository.deleteTrainings(id);
                artisanRepository.insertTrainings(id, request.getTrainings(), userId);
            }
            if (request.getLoans() != null) {
                listener.progress("Updating loans...");
                artisanRepository.deleteLoans(id);
                artisanRepository.insertLoans(id, request.getLoans(), userId);
            }
            if (request.getMachines() != null) {
                listener.progress("Updating machines...");
                artisanRepository.deleteMachines(id);
                artisanRepository.insertMachines(id, request.getMachines(), userId);
            }
            log.info("Artisan {} updated", id);
            return new ArtisanWriteResult(id, null, null);
        });
    }

    public void softDelete(Long id) {
        if (artisanRepository.softDelete(id) == 0) {
            throw new ResourceNotFoundException("Artisan", id);
        }
        log.info("Artisan {} deactivated", id);
    }

    private List<String> storeAll(List<UploadedFile> files, String folder, String prefix) {
        if (files == null || files.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> paths = new ArrayList<>(files.size());
        for (UploadedFile file : files) {
            paths.add(fileStorageService.store(file, folder, prefix));
        }
        return paths;
    }

    /** Removes staged uploads that never reached their final folder. */
    public void discardStaged(UploadedFile profilePicture, List<UploadedFile> productImages, List<UploadedFile> shopImages) {
        if (profilePicture != null) {
            fileStorageService.discard(profilePicture);
        }
        orEmpty(productImages).forEach(fileStorageService::discard);
        orEmpty(shopImages).forEach(fileStorageService::discard);
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? Collections.emptyList() : values;
    }

    public record ArtisanWriteResult(Long id, List<String> imagePaths, List<String> shopImagePaths) {
    }
}
