package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.ConversationRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.ConversationService;

@RestController
@RequestMapping("/conversations")
@Tag(name = "Conversation", description = "Chatbot transcript messages")
@AllArgsConstructor
public class ConversationController {
    private final ConversationService conversationService;

    @GetMapping
    @Operation(summary = "Get all messages", description = "Oldest first")
    public ResponseEntity<?> getConversations() {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved conversations")
                        .data(conversationService.findAll())
                        .build()
        );
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get messages of a session")
    public ResponseEntity<?> getSessionConversation(@PathVariable String sessionId) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved conversation")
                        .data(conversationService.findBySession(sessionId))
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Store message")
    public ResponseEntity<?> createConversation(@Valid @RequestBody ConversationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Conversation message stored")
                        .data(conversationService.create(request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete message")
    public ResponseEntity<?> deleteConversation(@PathVariable Long id) {
        conversationService.delete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Conversation message deleted")
                        .build()
        );
    }
}
