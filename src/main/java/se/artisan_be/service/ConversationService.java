package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.ConversationRequest;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.ChatConversation;
import se.artisan_be.repository.ChatConversationRepository;

import java.util.List;

@Service
@AllArgsConstructor
@Slf4j
public class ConversationService {
    private final ChatConversationRepository chatConversationRepository;

    public List<ChatConversation> findAll() {
        return chatConversationRepository.findAllByOrderBySentAtAsc();
    }

    public List<ChatConversation> findBySession(String sessionId) {
        return chatConversationRepository.findBySessionIdOrderBySentAtAsc(sessionId);
    }

    @Transactional
    public ChatConversation create(ConversationRequest request) {
        ChatConversation saved = chatConversationRepository.save(ChatConversation.builder()
                .userId(request.getUserId())
                .messageText(request.getMessageText())
                .isBot(Boolean.TRUE.equals(request.getIsBot()))
                .sessionId(request.getSessionId())
                .build());
        log.debug("Message {} stored for session {}", saved.getId(), saved.getSessionId());
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        if (!chatConversationRepository.existsById(id)) {
            throw new ResourceNotFoundException("Conversation", id);
        }
        chatConversationRepository.deleteById(id);
        log.info("Conversation message {} deleted", id);
    }
}
