package se.artisan_be.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import se.artisan_be.dto.request.ArtisanCreateRequest;
import se.artisan_be.dto.request.ArtisanDetailsRequest;
import se.artisan_be.dto.request.ArtisanUpdateRequest;
import se.artisan_be.dto.request.LoanRequest;
import se.artisan_be.dto.request.TrainingRequest;
import se.artisan_be.dto.response.ArtisanResponse;
import se.artisan_be.dto.response.TrainingResponse;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.service.ArtisanService;
import se.artisan_be.streaming.ProgressListener;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ArtisanLifecycleTest {

    @Autowired
    private ArtisanService artisanService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        for (String table : List.of("trainings", "loans", "machines", "product_images", "shop_images",
                "artisans", "techniques", "categories", "crafts", "geo_level")) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
    }

    @Test
    void create_storesArtisanWithChildrenAndResolvesNames() {
        // Arrange
        Long craftId = insert("INSERT INTO crafts (name) VALUES (?)", "Textile");
        Long categoryId = insert("INSERT INTO categories (name, craft_id) VALUES (?, ?)", "Embroidery", craftId);
        Long skillId = insert("INSERT INTO techniques (name, category_id) VALUES (?, ?)", "Phulkari", categoryId);
        insert("INSERT INTO geo_level (code, name) VALUES (?, ?)", "001", "Lahore Division");
        insert("INSERT INTO geo_level (code, name) VALUES (?, ?)", "001001", "Lahore District");
        Long tehsilId = insert("INSERT INTO geo_level (code, name) VALUES (?, ?)", "001001001", "Model Town");

        ArtisanDetailsRequest details = details("Amina", "Female", 7L);
        details.setSkillId(skillId);
        details.setTehsilId(tehsilId);
        ArtisanCreateRequest request = ArtisanCreateRequest.builder()
                .artisan(details)
                .trainings(List.of(training("Stitching"), training("Dyeing")))
                .loans(List.of(LoanRequest.builder().amount(new BigDecimal("25000.00"))
                        .date(LocalDate.of(2023, 5, 1)).loanType("Microfinance").lenderName("Akhuwat").build()))
                .build();

        // Act
        Long id = artisanService.create(request, null, null, null, ProgressListener.NONE).id();
        ArtisanResponse artisan = artisanService.getOne(id, false);

        // Assert
        assertThat(artisan.getTrainings()).extracting(TrainingResponse::getTitle).containsExactly("Stitching", "Dyeing");
        assertThat(artisan.getLoans()).hasSize(1);
        assertEquals(0, new BigDecimal("25000.00").compareTo(artisan.getLoans().get(0).getAmount()));
        assertNull(artisan.getMachines());
        assertEquals("Phulkari", artisan.getSkillName());
        assertEquals("Embroidery", artisan.getCategoryName());
        assertEquals("Textile", artisan.getCraftName());
        assertEquals("Model Town", artisan.getTehsilName());
        assertEquals("Lahore District", artisan.getDistrictName());
        assertEquals("Lahore Division", artisan.getDivisionName());
        Long childUserId = jdbcTemplate.queryForObject(
                "SELECT MAX(user_id) FROM trainings WHERE artisan_id = ?", Long.class, id);
        assertEquals(7L, childUserId);
    }

    @Test
    void update_replacesOnlySuppliedSections() {
        // Arrange
        Long id = create(details("Amina", "Female", 7L), training("A"), training("B"));
        jdbcTemplate.update("INSERT INTO loans (artisan_id, amount) VALUES (?, ?)", id, 1000);

        // Act
        artisanService.update(id, ArtisanUpdateRequest.builder()
                .trainings(List.of(training("C")))
                .build(), ProgressListener.NONE);

        // Assert
        ArtisanResponse artisan = artisanService.getOne(id, false);
        assertThat(artisan.getTrainings()).extracting(TrainingResponse::getTitle).containsExactly("C");
        assertThat(artisan.getLoans()).hasSize(1);
        assertEquals("Amina", artisan.getName());
    }

    @Test
    void update_overwritesTheArtisanRow() {
        Long id = create(details("Amina", "Female", 7L));
        ArtisanDetailsRequest changed = details("Amina Bibi", "Female", 7L);
        changed.setExperience(12);

        artisanService.update(id, ArtisanUpdateRequest.builder().artisan(changed).build(), ProgressListener.NONE);

        ArtisanResponse artisan = artisanService.getOne(id, false);
        assertEquals("Amina Bibi", artisan.getName());
        assertEquals(12, artisan.getExperience());
    }

    @Test
    void update_unknownArtisan_isNotFound() {
        ArtisanUpdateRequest request = ArtisanUpdateRequest.builder()
                .artisan(details("Nobody", "Male", 1L))
                .trainings(List.of(training("X")))
                .build();

        assertThrows(ResourceNotFoundException.class,
                () -> artisanService.update(999_999L, request, ProgressListener.NONE));

        Integer trainings = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM trainings", Integer.class);
        assertEquals(0, trainings);
    }

    @Test
    void update_softDeletedArtisan_isNotFoundAndKeepsExistingChildren() {
        // Arrange
        Long id = create(details("Amina", "Female", 7L), training("A"), training("B"));
        artisanService.softDelete(id);
        ArtisanUpdateRequest request = ArtisanUpdateRequest.builder()
                .trainings(List.of(training("C")))
                .build();

        // Act
        assertThrows(ResourceNotFoundException.class,
                () -> artisanService.update(id, request, ProgressListener.NONE));

        // Assert
        ArtisanResponse inactive = artisanService.getOne(id, true);
        assertThat(inactive.getTrainings()).extracting(TrainingResponse::getTitle).containsExactly("A", "B");
    }

    @Test
    void update_failingSection_rollsBackEverything() {
        // Arrange
        Long id = create(details("Amina", "Female", 7L), training("A"), training("B"));
        ArtisanUpdateRequest request = ArtisanUpdateRequest.builder()
                .artisan(details("Renamed", "Female", 7L))
                .trainings(List.of(training("C"), TrainingRequest.builder().build()))
                .build();

        // Act
        assertThrows(DataIntegrityViolationException.class,
                () -> artisanService.update(id, request, ProgressListener.NONE));

        // Assert
        ArtisanResponse artisan = artisanService.getOne(id, false);
        assertEquals("Amina", artisan.getName());
        assertThat(artisan.getTrainings()).extracting(TrainingResponse::getTitle).containsExactly("A", "B");
    }

    @Test
    void softDelete_hidesArtisanButKeepsChildren() {
        // Arrange
        Long id = create(details("Amina", "Female", 7L), training("A"));

        // Act
        artisanService.softDelete(id);

        // Assert
        assertThrows(ResourceNotFoundException.class, () -> artisanService.getOne(id, false));
        ArtisanResponse inactive = artisanService.getOne(id, true);
        assertFalse(inactive.getIsActive());
        assertThat(inactive.getTrainings()).hasSize(1);
        assertThat(artisanService.getAll(Map.of())).isEmpty();
        assertThrows(ResourceNotFoundException.class, () -> artisanService.softDelete(id));
    }

    @Test
    void getAll_appliesFilters() {
        create(details("Amina", "Female", 7L));
        create(details("Bilal", "Male", 8L));
        create(details("Sana", "Female", 8L));

        assertThat(artisanService.getAll(Map.of("gender", "Female")))
                .extracting(ArtisanResponse::getName).containsExactly("Amina", "Sana");
        assertThat(artisanService.getAll(Map.of("gender", "Female", "user_id", "8")))
                .extracting(ArtisanResponse::getName).containsExactly("Sana");
        assertThat(artisanService.getAll(Map.of("gender", "Select"))).hasSize(3);
        assertThat(artisanService.getAll(Map.of("user_id", "abc", "has_machinery", "maybe"))).hasSize(3);
    }

    private Long create(ArtisanDetailsRequest details, TrainingRequest... trainings) {
        ArtisanCreateRequest request = ArtisanCreateRequest.builder()
                .artisan(details)
                .trainings(new ArrayList<>(List.of(trainings)))
                .build();
        return artisanService.create(request, null, null, null, ProgressListener.NONE).id();
    }

    private Long insert(String sql, Object... params) {
        jdbcTemplate.update(sql, params);
        return jdbcTemplate.queryForObject("SELECT MAX(id) FROM " + sql.split("\\s+")[2], Long.class);
    }

    private static ArtisanDetailsRequest details(String name, String gender, Long userId) {
        return ArtisanDetailsRequest.builder()
                .name(name)
                .fatherName("Rashid")
                .cnic("3520212345671")
                .gender(gender)
                .dateOfBirth(LocalDate.of(1990, 4, 12))
                .experience(5)
                .avgMonthlyIncome(20000)
                .hasTraining(true)
                .userId(userId)
                .build();
    }

    private static TrainingRequest training(String title) {
        return TrainingRequest.builder().title(title).duration("3 months").organization("TEVTA").build();
    }
}
