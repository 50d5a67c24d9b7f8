package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.ChatSession;

import java.util.List;
import java.util.Optional;

public interface ChatSessionRepository extends JpaRepository<ChatSession, Long> {
    Optional<ChatSession> findBySessionId(String sessionId);

    boolean existsBySessionId(String sessionId);

    List<ChatSession> findAllByOrderByCreatedAtDesc();
}
