package se.artisan_be.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import se.artisan_be.dto.UploadedFile;
import se.artisan_be.exception.BadRequestException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class FileStorageServiceTest {

    @TempDir
    Path uploads;

    @Test
    void storeMovesStagedFileAndRemoveDeletesIt() {
        FileStorageService storage = new FileStorageService(uploads.toString());
        UploadedFile staged = storage.stage(new MockMultipartFile("profile_picture", "me.PNG", "image/png", new byte[]{1, 2}));

        String stored = storage.store(staged, FileStorageService.PROFILE_PICTURES, "profile_picture");

        assertFalse(Files.exists(staged.getTemporaryPath()));
        assertTrue(stored.endsWith(".png"));
        assertTrue(Files.exists(Paths.get(stored)));

        storage.remove(stored);

        assertFalse(Files.exists(Paths.get(stored)));
    }

    @Test
    void discard_deletesStagedUpload() {
        FileStorageService storage = new FileStorageService(uploads.toString());
        UploadedFile staged = storage.stage(new MockMultipartFile("shop_images", "shop.jpg", "image/jpeg", new byte[]{3}));

        storage.discard(staged);

        assertFalse(Files.exists(staged.getTemporaryPath()));
    }

    @Test
    void stage_rejectsNonImageContent() {
        FileStorageService storage = new FileStorageService(uploads.toString());

        assertThrows(BadRequestException.class,
                () -> storage.stage(new MockMultipartFile("product_images", "notes.txt", "text/plain", new byte[]{4})));
    }
}
