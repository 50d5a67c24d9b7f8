package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.ChatConversation;

import java.util.List;

public interface ChatConversationRepository extends JpaRepository<ChatConversation, Long> {
    List<ChatConversation> findAllByOrderBySentAtAsc();

    List<ChatConversation> findBySessionIdOrderBySentAtAsc(String sessionId);
}
