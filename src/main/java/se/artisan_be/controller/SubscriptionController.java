package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.SubscriptionRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.dto.response.SubscriptionResult;
import se.artisan_be.service.SubscriptionService;

@RestController
@RequestMapping("/subscriptions")
@Tag(name = "Subscription", description = "Email alert opt-in and opt-out")
@AllArgsConstructor
public class SubscriptionController {
    private final SubscriptionService subscriptionService;

    @GetMapping
    @Operation(summary = "Get all subscriptions")
    public ResponseEntity<?> getSubscriptions() {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved subscriptions")
                        .data(subscriptionService.findAll())
                        .build()
        );
    }

    @GetMapping("/active")
    @Operation(summary = "Get active subscriptions")
    public ResponseEntity<?> getActiveSubscriptions() {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved active subscriptions")
                        .data(subscriptionService.findActive())
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Subscribe", description = "Reactivates an inactive address; an active one is rejected with 409")
    public ResponseEntity<?> subscribe(@Valid @RequestBody SubscriptionRequest request) {
        SubscriptionResult result = subscriptionService.subscribe(request.getEmailAddress());
        HttpStatus status = result.isReactivated() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(
                ObjectResponse.builder()
                        .status(status.toString())
                        .message(result.isReactivated()
                                ? "Your subscription has been reactivated"
                                : "You have been successfully subscribed to email alerts")
                        .data(result)
                        .build()
        );
    }

    @GetMapping({"/unsubscribe", "/unsubscribe/{email}"})
    @Operation(summary = "Unsubscribe", description = "Email in the path or as ?email=")
    public ResponseEntity<?> unsubscribe(@PathVariable(value = "email", required = false) String pathEmail,
                                         @RequestParam(value = "email", required = false) String queryEmail) {
        subscriptionService.unsubscribe(pathEmail != null ? pathEmail : queryEmail);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("You have been successfully unsubscribed from email alerts")
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete subscription")
    public ResponseEntity<?> deleteSubscription(@PathVariable Long id) {
        subscriptionService.delete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Subscription deleted successfully")
                        .build()
        );
    }
}
