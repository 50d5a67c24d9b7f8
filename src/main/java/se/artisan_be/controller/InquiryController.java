package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.InquiryCreateRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.InquiryService;

@RestController
@RequestMapping("/inquiries")
@Tag(name = "Inquiry", description = "Public contact-form requests")
@AllArgsConstructor
public class InquiryController {
    private final InquiryService inquiryService;

    @GetMapping
    @Operation(summary = "Get all inquiries", description = "Newest first")
    public ResponseEntity<?> getInquiries() {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved inquiries")
                        .data(inquiryService.findAll())
                        .build()
        );
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get inquiry by ID")
    public ResponseEntity<?> getInquiry(@PathVariable Long id) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved inquiry")
                        .data(inquiryService.findById(id))
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Submit inquiry", description = "Sends a confirmation mail when mail is configured")
    public ResponseEntity<?> createInquiry(@Valid @RequestBody InquiryCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Inquiry submitted successfully")
                        .data(inquiryService.create(request))
                        .build()
        );
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update inquiry")
    public ResponseEntity<?> updateInquiry(@PathVariable Long id, @Valid @RequestBody InquiryCreateRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Inquiry updated successfully")
                        .data(inquiryService.update(id, request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete inquiry")
    public ResponseEntity<?> deleteInquiry(@PathVariable Long id) {
        inquiryService.delete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Inquiry deleted successfully")
                        .build()
        );
    }
}
