package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.GeoLevelRequest;
import se.artisan_be.exception.BadRequestException;
import se.artisan_be.exception.BusinessLogicException;
import se.artisan_be.exception.DuplicateResourceException;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.GeoLevel;
import se.artisan_be.repository.GeoLevelRepository;

import java.util.List;

@Service
@AllArgsConstructor
@Slf4j
public class GeoLevelService {
    private final GeoLevelRepository geoLevelRepository;

    /**
     * All areas, or only those whose code has the given length (3 divisions, 6 districts, 9 tehsils).
     */
    public List<GeoLevel> findAll(Integer codeLength) {
        if (codeLength == null) {
            return geoLevelRepository.findAll(Sort.by("name"));
        }
        if (codeLength <= 0) {
            throw new BadRequestException("code_length must be a positive number");
        }
        return geoLevelRepository.findByCodeLength(codeLength);
    }

    public List<GeoLevel> findChildren(String parentCode) {
        int childLength = switch (parentCode.length()) {
            case GeoLevel.DIVISION_CODE_LENGTH -> GeoLevel.DISTRICT_CODE_LENGTH;
            case GeoLevel.DISTRICT_CODE_LENGTH -> GeoLevel.TEHSIL_CODE_LENGTH;
            default -> throw new BusinessLogicException("Only divisions and districts have child areas");
        };
        return geoLevelRepository.findChildren(parentCode, childLength);
    }

    @Transactional
    public GeoLevel create(GeoLevelRequest request) {
        if (geoLevelRepository.existsByCode(request.getCode())) {
            throw new DuplicateResourceException("Geo level with code '" + request.getCode() + "' already exists");
        }
        GeoLevel saved = geoLevelRepository.save(GeoLevel.builder()
                .code(request.getCode())
                .name(request.getName().trim())
                .build());
        log.info("Geo level {} created with code {}", saved.getId(), saved.getCode());
        return saved;
    }

    @Transactional
    public GeoLevel update(Long id, GeoLevelRequest request) {
        GeoLevel existing = geoLevelRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Geo level", id));
        if (!existing.getCode().equals(request.getCode()) && geoLevelRepository.existsByCode(request.getCode())) {
            throw new DuplicateResourceException("Geo level with code '" + request.getCode() + "' already exists");
        }
        existing.setCode(request.getCode());
        existing.setName(request.getName().trim());
        log.info("Geo level {} updated", id);
        return geoLevelRepository.save(existing);
    }

    @Transactional
    public void delete(Long id) {
        if (!geoLevelRepository.existsById(id)) {
            throw new ResourceNotFoundException("Geo level", id);
        }
        geoLevelRepository.deleteById(id);
        log.info("Geo level {} deleted", id);
    }
}
