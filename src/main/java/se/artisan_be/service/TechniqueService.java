package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.TechniqueRequest;
import se.artisan_be.dto.response.TechniqueResponse;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.Technique;
import se.artisan_be.repository.CategoryRepository;
import se.artisan_be.repository.TechniqueRepository;
import se.artisan_be.repository.jdbc.SqlClient;

import java.util.List;
import java.util.Map;

import static se.artisan_be.util.RowValues.*;

/**
 * Techniques are the skills artisans register under. Deleting one only deactivates it so existing
 * artisans keep their skill reference.
 */
@Service
@AllArgsConstructor
@Slf4j
public class TechniqueService {

    private static final String SELECT_WITH_COUNTS = """
            SELECT t.*,
                   (SELECT COUNT(*) FROM artisans a WHERE a.skill_id = t.id AND a.is_active = TRUE) AS number_of_artisans
            FROM techniques_view t""";

    private final TechniqueRepository techniqueRepository;
    private final CategoryRepository categoryRepository;
    private final SqlClient sqlClient;

    public List<TechniqueResponse> findAll() {
        String sql = SELECT_WITH_COUNTS + " WHERE t.is_active = TRUE ORDER BY t.craft_name, t.category_name, t.name";
        return sqlClient.queryAll(sql).stream()
                .map(this::convertToDTO)
                .toList();
    }

    @Transactional
    public TechniqueResponse createTechnique(TechniqueRequest request) {
        requireCategory(request.getCategoryId());
        Technique technique = Technique.builder()
                .name(request.getName().trim())
                .categoryId(request.getCategoryId())
                .color(request.getColor())
                .isActive(request.getIsActive() == null || request.getIsActive())
                .build();
        Technique saved = techniqueRepository.save(technique);
        log.info("Technique {} created under category {}", saved.getId(), saved.getCategoryId());
        return findOne(saved.getId());
    }

    @Transactional
    public TechniqueResponse updateTechnique(Long id, TechniqueRequest request) {
        Technique technique = techniqueRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Technique", id));
        requireCategory(request.getCategoryId());
        technique.setName(request.getName().trim());
        technique.setCategoryId(request.getCategoryId());
        technique.setColor(request.getColor());
        if (request.getIsActive() != null) {
            technique.setIsActive(request.getIsActive());
        }
        techniqueRepository.save(technique);
        log.info("Technique {} updated", id);
        return findOne(id);
    }

    @Transactional
    public void deactivateTechnique(Long id) {
        Technique technique = techniqueRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Technique", id));
        technique.setIsActive(false);
        techniqueRepository.save(technique);
        log.info("Technique {} deactivated", id);
    }

    private TechniqueResponse findOne(Long id) {
        techniqueRepository.flush();
        return sqlClient.queryOne(SELECT_WITH_COUNTS + " WHERE t.id = ?", id)
                .map(this::convertToDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Technique", id));
    }

    private void requireCategory(Long categoryId) {
        if (categoryId != null && !categoryRepository.existsById(categoryId)) {
            throw new ResourceNotFoundException("Category", categoryId);
        }
    }

    private TechniqueResponse convertToDTO(Map<String, Object> row) {
        return TechniqueResponse.builder()
                .id(asLong(row, "id"))
                .name(asString(row, "name"))
                .color(asString(row, "color"))
                .categoryId(asLong(row, "category_id"))
                .categoryName(asString(row, "category_name"))
                .craftId(asLong(row, "craft_id"))
                .craftName(asString(row, "craft_name"))
                .isActive(asBoolean(row, "is_active"))
                .numberOfArtisans(numberOrZero(row, "number_of_artisans").longValue())
                .build();
    }
}
