package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.CategoryRequest;
import se.artisan_be.dto.response.CategoryResponse;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.Category;
import se.artisan_be.repository.CategoryRepository;
import se.artisan_be.repository.CraftRepository;
import se.artisan_be.repository.jdbc.SqlClient;

import java.util.List;
import java.util.Map;

import static se.artisan_be.util.RowValues.*;

@Service
@AllArgsConstructor
@Slf4j
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final CraftRepository craftRepository;
    private final SqlClient sqlClient;

    public List<CategoryResponse> findAll() {
        return sqlClient.queryAll("SELECT * FROM categories_view ORDER BY craft_name, name").stream()
                .map(this::convertToDTO)
                .toList();
    }

    @Transactional
    public CategoryResponse createCategory(CategoryRequest request) {
        requireCraft(request.getCraftId());
        Category category = Category.builder()
                .name(request.getName().trim())
                .craftId(request.getCraftId())
                .isActive(request.getIsActive() == null || request.getIsActive())
                .build();
        Category saved = categoryRepository.save(category);
        log.info("Category {} created under craft {}", saved.getId(), saved.getCraftId());
        return findOne(saved.getId());
    }

    @Transactional
    public CategoryResponse updateCategory(Long id, CategoryRequest request) {
        Category category = categoryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Category", id));
        requireCraft(request.getCraftId());
        category.setName(request.getName().trim());
        category.setCraftId(request.getCraftId());
        if (request.getIsActive() != null) {
            category.setIsActive(request.getIsActive());
        }
        categoryRepository.saveAndFlush(category);
        log.info("Category {} updated", id);
        return findOne(id);
    }

    @Transactional
    public void deleteCategory(Long id) {
        if (!categoryRepository.existsById(id)) {
            throw new ResourceNotFoundException("Category", id);
        }
        categoryRepository.deleteById(id);
        log.info("Category {} deleted", id);
    }

    private CategoryResponse findOne(Long id) {
        categoryRepository.flush();
        return sqlClient.queryOne("SELECT * FROM categories_view WHERE id = ?", id)
                .map(this::convertToDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Category", id));
    }

    private void requireCraft(Long craftId) {
        if (craftId != null && !craftRepository.existsById(craftId)) {
            throw new ResourceNotFoundException("Craft", craftId);
        }
    }

    private CategoryResponse convertToDTO(Map<String, Object> row) {
        return CategoryResponse.builder()
                .id(asLong(row, "id"))
                .name(asString(row, "name"))
                .craftId(asLong(row, "craft_id"))
                .craftName(asString(row, "craft_name"))
                .isActive(asBoolean(row, "is_active"))
                .build();
    }
}
