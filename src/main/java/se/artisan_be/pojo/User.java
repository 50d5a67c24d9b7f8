package se.artisan_be.pojo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "users")
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String username;

    @Column(nullable = false)
    @JsonIgnore
    @ToString.Exclude
    private String password;

    private String roles;

    @Column(length = 16)
    private String geoLevelCode;

    @Builder.Default
    @Column(nullable = false)
    private Boolean isMobileUser = false;

    @Builder.Default
    @Column(nullable = false)
    private Boolean isActive = true;

    /** The user who registered this account. */
    private Long userId;
}
