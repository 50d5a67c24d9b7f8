package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.SessionRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.SessionService;

@RestController
@RequestMapping("/sessions")
@Tag(name = "Session", description = "Chatbot session metadata")
@AllArgsConstructor
public class SessionController {
    private final SessionService sessionService;

    @GetMapping
    @Operation(summary = "Get all sessions", description = "Newest first")
    public ResponseEntity<?> getSessions() {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved sessions")
                        .data(sessionService.findAll())
                        .build()
        );
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get session")
    public ResponseEntity<?> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved session")
                        .data(sessionService.findBySessionId(sessionId))
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Create session")
    public ResponseEntity<?> createSession(@RequestBody SessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Session created successfully")
                        .data(sessionService.create(request))
                        .build()
        );
    }

    @PutMapping("/{sessionId}")
    @Operation(summary = "Update session")
    public ResponseEntity<?> updateSession(@PathVariable String sessionId, @RequestBody SessionRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Session updated successfully")
                        .data(sessionService.update(sessionId, request))
                        .build()
        );
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Delete session")
    public ResponseEntity<?> deleteSession(@PathVariable String sessionId) {
        sessionService.delete(sessionId);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Session deleted successfully")
                        .build()
        );
    }
}
