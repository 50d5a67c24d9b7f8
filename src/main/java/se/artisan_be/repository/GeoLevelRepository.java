package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.artisan_be.pojo.GeoLevel;

import java.util.List;
import java.util.Optional;

public interface GeoLevelRepository extends JpaRepository<GeoLevel, Long> {

    Optional<GeoLevel> findByCode(String code);

    boolean existsByCode(String code);

    @Query("SELECT g FROM GeoLevel g WHERE LENGTH(g.code) = :length ORDER BY g.name")
    List<GeoLevel> findByCodeLength(@Param("length") int length);

    /**
     * Areas nested under a parent code, e.g. the districts of a division.
     */
    @Query("SELECT g FROM GeoLevel g WHERE g.code LIKE CONCAT(:parentCode, '%') AND LENGTH(g.code) = :length ORDER BY g.name")
    List<GeoLevel> findChildren(@Param("parentCode") String parentCode, @Param("length") int length);
}
