package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.EducationLevel;

public interface EducationLevelRepository extends JpaRepository<EducationLevel, Long> {
}
