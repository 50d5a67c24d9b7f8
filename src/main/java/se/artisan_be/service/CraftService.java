package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.CraftRequest;
import se.artisan_be.dto.response.CraftResponse;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.Craft;
import se.artisan_be.repository.CraftRepository;
import se.artisan_be.repository.jdbc.SqlClient;

import java.util.List;
import java.util.Map;

import static se.artisan_be.util.RowValues.*;

@Service
@AllArgsConstructor
@Slf4j
public class CraftService {

    private static final String LIST_QUERY = """
            SELECT c.id, c.name, c.is_active,
                   (SELECT COUNT(*) FROM categories cat WHERE cat.craft_id = c.id) AS number_of_categories,
                   (SELECT COUNT(*) FROM techniques_view t WHERE t.craft_id = c.id) AS number_of_techniques,
                   (SELECT COUNT(*) FROM artisans a
                      JOIN techniques_view t ON t.id = a.skill_id
                     WHERE t.craft_id = c.id AND a.is_active = TRUE) AS number_of_artisans
            FROM crafts c
            ORDER BY c.name""";

    private final CraftRepository craftRepository;
    private final SqlClient sqlClient;

    public List<CraftResponse> findAll() {
        return sqlClient.queryAll(LIST_QUERY).stream()
                .map(this::convertToDTO)
                .toList();
    }

    @Transactional
    public CraftResponse createCraft(CraftRequest request) {
        Craft craft = Craft.builder()
                .name(request.getName().trim())
                .isActive(request.getIsActive() == null || request.getIsActive())
                .build();
        Craft saved = craftRepository.save(craft);
        log.info("Craft {} created: {}", saved.getId(), saved.getName());
        return convertToDTO(saved);
    }

    @Transactional
    public CraftResponse updateCraft(Long id, CraftRequest request) {
        Craft craft = craftRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Craft", id));
        craft.setName(request.getName().trim());
        if (request.getIsActive() != null) {
            craft.setIsActive(request.getIsActive());
        }
        log.info("Craft {} updated", id);
        return convertToDTO(craftRepository.save(craft));
    }

    @Transactional
    public void deleteCraft(Long id) {
        if (!craftRepository.existsById(id)) {
            throw new ResourceNotFoundException("Craft", id);
        }
        craftRepository.deleteById(id);
        log.info("Craft {} deleted", id);
    }

    private CraftResponse convertToDTO(Map<String, Object> row) {
        return CraftResponse.builder()
                .id(asLong(row, "id"))
                .name(asString(row, "name"))
                .isActive(asBoolean(row, "is_active"))
                .numberOfCategories(numberOrZero(row, "number_of_categories").longValue())
                .numberOfTechniques(numberOrZero(row, "number_of_techniques").longValue())
                .numberOfArtisans(numberOrZero(row, "number_of_artisans").longValue())
                .build();
    }

    private CraftResponse convertToDTO(Craft craft) {
        return CraftResponse.builder()
                .id(craft.getId())
                .name(craft.getName())
                .isActive(craft.getIsActive())
                .build();
    }
}
