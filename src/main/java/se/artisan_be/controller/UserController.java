package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.request.LoginRequest;
import se.artisan_be.dto.request.UserRegisterRequest;
import se.artisan_be.dto.request.UserUpdateRequest;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.UserService;

@RestController
@Tag(name = "User", description = "Registry operator accounts")
@AllArgsConstructor
public class UserController {
    private final UserService userService;

    @GetMapping("/users")
    @Operation(summary = "Get all users", description = "Each user carries its region name and the number of artisans it registered")
    public ResponseEntity<?> getUsers() {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Successfully retrieved users")
                        .data(userService.findAll())
                        .build()
        );
    }

    @PostMapping("/user/register")
    @Operation(summary = "Register user", description = "A random password is generated and returned once")
    public ResponseEntity<?> register(@Valid @RequestBody UserRegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ObjectResponse.builder()
                        .status(HttpStatus.CREATED.toString())
                        .message("User registered successfully")
                        .data(userService.register(request))
                        .build()
        );
    }

    @PostMapping("/user/login")
    @Operation(summary = "Login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("Login successful")
                        .data(userService.login(request))
                        .build()
        );
    }

    @PutMapping("/user/{id}")
    @Operation(summary = "Update user", description = "Only the supplied fields are changed")
    public ResponseEntity<?> updateUser(@PathVariable Long id, @Valid @RequestBody UserUpdateRequest request) {
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("User updated successfully")
                        .data(userService.update(id, request))
                        .build()
        );
    }

    @DeleteMapping("/user/{id}")
    @Operation(summary = "Delete user")
    public ResponseEntity<?> deleteUser(@PathVariable Long id) {
        userService.delete(id);
        return ResponseEntity.ok(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message("User deleted successfully")
                        .build()
        );
    }
}
