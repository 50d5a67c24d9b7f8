package se.artisan_be.dbinit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import se.artisan_be.pojo.*;
import se.artisan_be.repository.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills empty reference tables with a starter set so a fresh database can register artisans right away.
 */
@Component
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final EducationLevelRepository educationLevelRepository;
    private final EmploymentTypeRepository employmentTypeRepository;
    private final CraftRepository craftRepository;
    private final CategoryRepository categoryRepository;
    private final TechniqueRepository techniqueRepository;
    private final GeoLevelRepository geoLevelRepository;

    @Value("${app.seed-reference-data:true}")
    private boolean seedReferenceData;

    public DataInitializer(EducationLevelRepository educationLevelRepository,
                           EmploymentTypeRepository employmentTypeRepository,
                           CraftRepository craftRepository,
                           CategoryRepository categoryRepository,
                           TechniqueRepository techniqueRepository,
                           GeoLevelRepository geoLevelRepository) {
        this.educationLevelRepository = educationLevelRepository;
        this.employmentTypeRepository = employmentTypeRepository;
        this.craftRepository = craftRepository;
        this.categoryRepository = categoryRepository;
        this.techniqueRepository = techniqueRepository;
        this.geoLevelRepository = geoLevelRepository;
    }

    @Override
    public void run(String... args) {
        if (!seedReferenceData) {
            log.info("Reference data seeding disabled");
            return;
        }
        initEducationLevels();
        initEmploymentTypes();
        initCraftHierarchy();
        initGeoLevels();
    }

    private void initEducationLevels() {
        try {
            if (educationLevelRepository.count() == 0) {
                List<EducationLevel> levels = new ArrayList<>();
                for (String name : List.of("No Formal Education", "Primary", "Middle", "Matric", "Intermediate",
                        "Graduate", "Post Graduate")) {
                    levels.add(EducationLevel.builder().name(name).build());
                }
                educationLevelRepository.saveAll(levels);
                log.info("Default education levels have been created");
            }
        } catch (DataAccessException e) {
            log.error("Error initializing education levels: {}", e.getMessage(), e);
        }
    }

    private void initEmploymentTypes() {
        try {
            if (employmentTypeRepository.count() == 0) {
                List<EmploymentType> types = new ArrayList<>();
                for (String name : List.of("Self Employed", "Employed", "Daily Wager", "Unemployed")) {
                    types.add(EmploymentType.builder().name(name).build());
                }
                employmentTypeRepository.saveAll(types);
                log.info("Default employment types have been created");
            }
        } catch (DataAccessException e) {
            log.error("Error initializing employment types: {}", e.getMessage(), e);
        }
    }

    private void initCraftHierarchy() {
        try {
            if (craftRepository.count() == 0) {
                Craft textiles = craftRepository.save(Craft.builder().name("Textiles").build());
                Craft pottery = craftRepository.save(Craft.builder().name("Pottery").build());
                Craft woodwork = craftRepository.save(Craft.builder().name("Woodwork").build());

                Category embroidery = categoryRepository.save(
                        Category.builder().name("Embroidery").craftId(textiles.getId()).build());
                Category weaving = categoryRepository.save(
                        Category.builder().name("Weaving").craftId(textiles.getId()).build());
                Category ceramics = categoryRepository.save(
                        Category.builder().name("Ceramics").craftId(pottery.getId()).build());
                Category carving = categoryRepository.save(
                        Category.builder().name("Carving").craftId(woodwork.getId()).build());

                techniqueRepository.saveAll(List.of(
                        Technique.builder().name("Hand Embroidery").categoryId(embroidery.getId()).color("#E57373").build(),
                        Technique.builder().name("Mirror Work").categoryId(embroidery.getId()).color("#F06292").build(),
                        Technique.builder().name("Carpet Weaving").categoryId(weaving.getId()).color("#64B5F6").build(),
                        Technique.builder().name("Khaddar Weaving").categoryId(weaving.getId()).color("#4FC3F7").build(),
                        Technique.builder().name("Blue Pottery").categoryId(ceramics.getId()).color("#1E88E5").build(),
                        Technique.builder().name("Wood Carving").categoryId(carving.getId()).color("#8D6E63").build()));
                log.info("Default craft hierarchy has been created");
            }
        } catch (DataAccessException e) {
            log.error("Error initializing craft hierarchy: {}", e.getMessage(), e);
        }
    }

    private void initGeoLevels() {
        try {
            if (geoLevelRepository.count() == 0) {
                geoLevelRepository.saveAll(List.of(
                        GeoLevel.builder().code("001").name("Lahore").build(),
                        GeoLevel.builder().code("001001").name("Lahore District").build(),
                        GeoLevel.builder().code("001001001").name("Lahore City").build(),
                        GeoLevel.builder().code("001001002").name("Lahore Cantt").build(),
                        GeoLevel.builder().code("001002").name("Kasur").build(),
                        GeoLevel.builder().code("001002001").name("Kasur Tehsil").build(),
                        GeoLevel.builder().code("002").name("Multan").build(),
                        GeoLevel.builder().code("002001").name("Multan District").build(),
                        GeoLevel.builder().code("002001001").name("Multan City").build()));
                log.info("Default geo levels have been created");
            }
        } catch (DataAccessException e) {
            log.error("Error initializing geo levels: {}", e.getMessage(), e);
        }
    }
}
