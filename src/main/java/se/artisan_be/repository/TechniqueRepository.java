package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.Technique;

public interface TechniqueRepository extends JpaRepository<Technique, Long> {
}
