package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.SessionRequest;
import se.artisan_be.exception.BadRequestException;
import se.artisan_be.exception.DuplicateResourceException;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.ChatSession;
import se.artisan_be.repository.ChatSessionRepository;

import java.util.List;

/**
 * Chatbot session metadata, addressed by the client-generated session id rather than the row id.
 */
@Service
@AllArgsConstructor
@Slf4j
public class SessionService {
    private final ChatSessionRepository chatSessionRepository;

    public List<ChatSession> findAll() {
        return chatSessionRepository.findAllByOrderByCreatedAtDesc();
    }

    public ChatSession findBySessionId(String sessionId) {
        return chatSessionRepository.findBySessionId(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session not found with id: " + sessionId));
    }

    @Transactional
    public ChatSession create(SessionRequest request) {
        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            throw new BadRequestException("session_id is required");
        }
        if (chatSessionRepository.existsBySessionId(request.getSessionId())) {
            throw new DuplicateResourceException("Session '" + request.getSessionId() + "' already exists");
        }
        ChatSession session = new ChatSession();
        session.setSessionId(request.getSessionId());
        apply(session, request);
        ChatSession saved = chatSessionRepository.save(session);
        log.info("Session {} started", saved.getSessionId());
        return saved;
    }

    @Transactional
    public ChatSession update(String sessionId, SessionRequest request) {
        ChatSession session = findBySessionId(sessionId);
        apply(session, request);
        log.info("Session {} updated", sessionId);
        return chatSessionRepository.save(session);
    }

    @Transactional
    public void delete(String sessionId) {
        chatSessionRepository.delete(findBySessionId(sessionId));
        log.info("Session {} deleted", sessionId);
    }

    private static void apply(ChatSession session, SessionRequest request) {
        session.setChatTitle(request.getChatTitle());
        session.setDescription(request.getDescription());
        session.setStartTime(request.getStartTime());
        session.setEndTime(request.getEndTime());
        session.setUserIp(request.getUserIp());
        session.setUserAgent(request.getUserAgent());
        session.setStatus(request.getStatus());
        session.setTags(request.getTags());
        session.setNotes(request.getNotes());
    }
}
