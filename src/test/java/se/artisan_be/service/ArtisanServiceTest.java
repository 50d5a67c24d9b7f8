package se.artisan_be.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import se.artisan_be.dto.UploadedFile;
import se.artisan_be.dto.request.ArtisanCreateRequest;
import se.artisan_be.dto.request.ArtisanDetailsRequest;
import se.artisan_be.mapper.ArtisanMapper;
import se.artisan_be.repository.ArtisanRepository;
import se.artisan_be.repository.jdbc.SqlClient;
import se.artisan_be.streaming.ProgressListener;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArtisanServiceTest {

    private static final String STORED_PROFILE = "uploads/profile_pictures/profile_picture-1-2.png";

    @Mock
    private ArtisanRepository artisanRepository;

    @Mock
    private ArtisanMapper artisanMapper;

    @Mock
    private FileStorageService fileStorageService;

    @Mock
    private SqlClient sqlClient;

    @InjectMocks
    private ArtisanService artisanService;

    @Test
    void create_failedArtisanInsert_removesStoredProfilePicture() {
        // Arrange
        UploadedFile profile = new UploadedFile("me.png", Path.of("uploads/tmp/abc.png"));
        ArtisanCreateRequest request = request();
        when(fileStorageService.store(profile, FileStorageService.PROFILE_PICTURES, "profile_picture"))
                .thenReturn(STORED_PROFILE);
        when(artisanRepository.insertArtisan(request.getArtisan(), STORED_PROFILE))
                .thenThrow(new DataIntegrityViolationException("NULL not allowed for column \"NAME\""));

        // Act
        assertThrows(DataIntegrityViolationException.class,
                () -> artisanService.create(request, profile, List.of(), List.of(), ProgressListener.NONE));

        // Assert
        verify(fileStorageService).remove(STORED_PROFILE);
        verify(fileStorageService).discard(profile);
        verify(artisanRepository, never()).insertTrainings(anyLong(), anyList(), any());
    }

    @Test
    void create_successfulInsert_keepsStoredProfilePicture() {
        // Arrange
        UploadedFile profile = new UploadedFile("me.png", Path.of("uploads/tmp/abc.png"));
        ArtisanCreateRequest request = request();
        when(fileStorageService.store(profile, FileStorageService.PROFILE_PICTURES, "profile_picture"))
                .thenReturn(STORED_PROFILE);
        when(artisanRepository.insertArtisan(request.getArtisan(), STORED_PROFILE)).thenReturn(5L);

        // Act
        ArtisanService.ArtisanWriteResult result =
                artisanService.create(request, profile, List.of(), List.of(), ProgressListener.NONE);

        // Assert
        assertEquals(5L, result.id());
        verify(fileStorageService, never()).remove(anyString());
    }

    @Test
    void discardStaged_removesEveryStagedUpload() {
        UploadedFile profile = new UploadedFile("me.png", Path.of("uploads/tmp/a.png"));
        UploadedFile product = new UploadedFile("pot.png", Path.of("uploads/tmp/b.png"));
        UploadedFile shop = new UploadedFile("shop.png", Path.of("uploads/tmp/c.png"));

        artisanService.discardStaged(profile, List.of(product), List.of(shop));

        verify(fileStorageService).discard(profile);
        verify(fileStorageService).discard(product);
        verify(fileStorageService).discard(shop);
    }

    private static ArtisanCreateRequest request() {
        return ArtisanCreateRequest.builder()
                .artisan(ArtisanDetailsRequest.builder().name("Amina").fatherName("Rashid").build())
                .build();
    }
}
