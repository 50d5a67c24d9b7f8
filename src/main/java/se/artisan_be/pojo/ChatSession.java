package se.artisan_be.pojo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "sessions")
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatSession extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String sessionId;

    private String chatTitle;

    @Column(length = 2048)
    private String description;

    private LocalDateTime startTime;
    private LocalDateTime endTime;

    @Column(length = 64)
    private String userIp;

    @Column(length = 1024)
    private String userAgent;

    @Column(length = 64)
    private String status;

    @Column(length = 1024)
    private String tags;

    @Column(length = 4096)
    private String notes;
}
