package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.EmploymentType;

public interface EmploymentTypeRepository extends JpaRepository<EmploymentType, Long> {
}
