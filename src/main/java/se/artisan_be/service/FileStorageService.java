package se.artisan_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;
import se.artisan_be.dto.UploadedFile;
import se.artisan_be.exception.BadRequestException;
import se.artisan_be.exception.FileStorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

@Service
@Slf4j
public class FileStorageService {

    public static final String PRODUCT_IMAGES = "product_images";
    public static final String SHOP_IMAGES = "shop_images";
    public static final String PROFILE_PICTURES = "profile_pictures";

    private final Path root;

    public FileStorageService(@Value("${app.uploads.dir:uploads}") String uploadsDir) {
        this.root = Paths.get(uploadsDir);
    }

    /**
     * Writes an image upload to {@code <uploads>/tmp}. Non-image content is rejected.
     */
    public UploadedFile stage(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new BadRequestException("Only image files are allowed: " + file.getOriginalFilename());
        }
        String originalName = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        try {
            Path tmpDir = Files.createDirectories(root.resolve("tmp"));
            Path target = tmpDir.resolve(UUID.randomUUID() + extensionOf(originalName));
            file.transferTo(target.toAbsolutePath());
            return new UploadedFile(originalName, target);
        } catch (IOException e) {
            throw new FileStorageException("Failed to stage upload " + originalName, e);
        }
    }

    /**
     * Moves a staged upload into {@code folder} under a unique name and returns its relative path,
     * e.g. {@code uploads/product_images/product_image-1700000000000-123456789.jpg}.
     */
    public String store(UploadedFile file, String folder, String prefix) {
        String filename = prefix + "-" + System.currentTimeMillis() + "-"
                + ThreadLocalRandom.current().nextInt(1_000_000_000) + extensionOf(file.getOriginalName());
        try {
            Path dir = Files.createDirectories(root.resolve(folder));
            Path target = dir.resolve(filename);
            Files.move(file.getTemporaryPath(), target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored {} as {}", file.getOriginalName(), target);
            return target.toString().replace('\\', '/');
        } catch (IOException e) {
            throw new FileStorageException("Failed to store upload " + file.getOriginalName(), e);
        }
    }

    public void discard(UploadedFile file) {
        try {
            Files.deleteIfExists(file.getTemporaryPath());
        } catch (IOException e) {
            log.warn("Could not remove staged upload {}: {}", file.getTemporaryPath(), e.getMessage());
        }
    }

    /**
     * Deletes a file previously returned by {@link #store}.
     */
    public void remove(String storedPath) {
        try {
            Files.deleteIfExists(Paths.get(storedPath));
        } catch (IOException e) {
            log.warn("Could not remove stored upload {}: {}", storedPath, e.getMessage());
        }
    }

    private static String extensionOf(String name) {
        String extension = StringUtils.getFilenameExtension(name);
        return extension == null ? "" : "." + extension.toLowerCase();
    }
}
