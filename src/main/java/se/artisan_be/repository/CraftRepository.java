package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.Craft;

public interface CraftRepository extends JpaRepository<Craft, Long> {
}
