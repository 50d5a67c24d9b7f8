package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.LookupRequest;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.EducationLevel;
import se.artisan_be.repository.EducationLevelRepository;

import java.util.List;

@Service
@AllArgsConstructor
@Slf4j
public class EducationService {
    private final EducationLevelRepository educationLevelRepository;

    public List<EducationLevel> findAll() {
        return educationLevelRepository.findAll(Sort.by("id"));
    }

    @Transactional
    public EducationLevel create(LookupRequest request) {
        EducationLevel saved = educationLevelRepository.save(EducationLevel.builder()
                .name(request.getName().trim())
                .isActive(request.getIsActive() == null || request.getIsActive())
                .build());
        log.info("Education level {} created: {}", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public EducationLevel update(Long id, LookupRequest request) {
        EducationLevel existing = educationLevelRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Education level", id));
        existing.setName(request.getName().trim());
        if (request.getIsActive() != null) {
            existing.setIsActive(request.getIsActive());
        }
        log.info("Education level {} updated", id);
        return educationLevelRepository.save(existing);
    }

    @Transactional
    public void delete(Long id) {
        if (!educationLevelRepository.existsById(id)) {
            throw new ResourceNotFoundException("Education level", id);
        }
        educationLevelRepository.deleteById(id);
        log.info("Education level {} deleted", id);
    }
}
