package se.artisan_be.pojo;

import jakarta.persistence.*;
import lombok.*;

/**
 * Administrative area. Codes nest by prefix: division (3 chars), district (6), tehsil (9).
 */
@Entity
@Table(name = "geo_level")
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeoLevel extends BaseEntity {

    public static final int DIVISION_CODE_LENGTH = 3;
    public static final int DISTRICT_CODE_LENGTH = 6;
    public static final int TEHSIL_CODE_LENGTH = 9;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 16)
    private String code;

    @Column(nullable = false)
    private String name;
}
