package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.LookupRequest;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.EmploymentType;
import se.artisan_be.repository.EmploymentTypeRepository;

import java.util.List;

@Service
@AllArgsConstructor
@Slf4j
public class EmploymentTypeService {
    private final EmploymentTypeRepository employmentTypeRepository;

    public List<EmploymentType> findAll() {
        return employmentTypeRepository.findAll(Sort.by("id"));
    }

    @Transactional
    public EmploymentType create(LookupRequest request) {
        EmploymentType saved = employmentTypeRepository.save(EmploymentType.builder()
                .name(request.getName().trim())
                .isActive(request.getIsActive() == null || request.getIsActive())
                .build());
        log.info("Employment type {} created: {}", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public EmploymentType update(Long id, LookupRequest request) {
        EmploymentType existing = employmentTypeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employment type", id));
        existing.setName(request.getName().trim());
        if (request.getIsActive() != null) {
            existing.setIsActive(request.getIsActive());
        }
        log.info("Employment type {} updated", id);
        return employmentTypeRepository.save(existing);
    }

    @Transactional
    public void delete(Long id) {
        if (!employmentTypeRepository.existsById(id)) {
            throw new ResourceNotFoundException("Employment type", id);
        }
        employmentTypeRepository.deleteById(id);
        log.info("Employment type {} deleted", id);
    }
}
