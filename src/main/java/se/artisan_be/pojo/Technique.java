package se.artisan_be.pojo;

import jakarta.persistence.*;
import lombok.*;

/**
 * A skill an artisan practises; the leaf of the craft, category, technique hierarchy.
 */
@Entity
@Table(name = "techniques")
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Technique extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private Long categoryId;

    @Column(length = 32)
    private String color;

    @Builder.Default
    @Column(nullable = false)
    private Boolean isActive = true;
}
