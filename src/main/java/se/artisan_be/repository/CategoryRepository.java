package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.Category;

public interface CategoryRepository extends JpaRepository<Category, Long> {
}
