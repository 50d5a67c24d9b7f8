package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.CategoryRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.CategoryService;

@RestController
@RequestMapping("/categories")
@Tag(name = "Category", description = "API for category management")
@AllArgsConstructor
public class CategoryController {
    private final CategoryService categoryService;

    @GetMapping
    @Operation(summary = "Get all categories", description = "Each category carries the name of its craft")
    public ResponseEntity<?> getCategories() {
        return ResponseEntity.status(HttpStatus.OK).body(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved categories")
                        .data(categoryService.findAll())
                        .build()
        );
    }

    @PostMapping
    @Operation(summary = "Create new category")
    public ResponseEntity<?> createCategory(@Valid @RequestBody CategoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("Category created successfully")
                        .data(categoryService.createCategory(request))
                        .build()
        );
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update category")
    public ResponseEntity<?> updateCategory(@PathVariable Long id, @Valid @RequestBody CategoryRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Category updated successfully")
                        .data(categoryService.updateCategory(id, request))
                        .build()
        );
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete category")
    public ResponseEntity<?> deleteCategory(@PathVariable Long id) {
        categoryService.deleteCategory(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Category deleted successfully")
                        .build()
        );
    }
}
