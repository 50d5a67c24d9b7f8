package se.artisan_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import se.artisan_be.dto.request.LoginRequest;
import se.artisan_be.dto.request.UserRegisterRequest;
import se.artisan_be.dto.request.UserUpdateRequest;
import se.artisan_be.dto.response.UserRegistrationResponse;
import se.artisan_be.dto.response.UserResponse;
import se.artisan_be.exception.DuplicateResourceException;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.exception.UnauthorizedException;
import se.artisan_be.pojo.GeoLevel;
import se.artisan_be.pojo.User;
import se.artisan_be.repository.GeoLevelRepository;
import se.artisan_be.repository.UserRepository;
import se.artisan_be.repository.jdbc.SqlClient;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private GeoLevelRepository geoLevelRepository;

    @Mock
    private SqlClient sqlClient;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(userRepository, geoLevelRepository, passwordEncoder, sqlClient);
    }

    @Test
    void register_storesOnlyTheHashOfTheGeneratedPassword() {
        // Arrange
        when(userRepository.existsByUsername("field01")).thenReturn(false);
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            user.setId(3L);
            return user;
        });
        UserRegisterRequest request = UserRegisterRequest.builder()
                .username("field01").roles("surveyor").geoLevelCode("001001001").isMobileUser(true).userId(1L)
                .build();

        // Act
        UserRegistrationResponse response = userService.register(request);

        // Assert
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        User stored = captor.getValue();
        String generated = response.getGeneratedPassword();
        assertEquals(UserService.PASSWORD_LENGTH, generated.length());
        assertTrue(generated.chars().allMatch(c -> UserService.PASSWORD_ALPHABET.indexOf(c) >= 0));
        assertNotEquals(generated, stored.getPassword());
        assertTrue(passwordEncoder.matches(generated, stored.getPassword()));
        assertTrue(stored.getIsMobileUser());
        assertEquals(3L, response.getId());
    }

    @Test
    void register_takenUsername_isConflict() {
        when(userRepository.existsByUsername("field01")).thenReturn(true);

        assertThrows(DuplicateResourceException.class,
                () -> userService.register(UserRegisterRequest.builder().username("field01").build()));

        verify(userRepository, never()).save(any());
    }

    @Test
    void login_withCorrectPassword_returnsUserWithRegion() {
        // Arrange
        User user = User.builder().id(2L).username("field01").password(passwordEncoder.encode("bcdfgh"))
                .geoLevelCode("001").isActive(true).build();
        when(userRepository.findByUsername("field01")).thenReturn(Optional.of(user));
        when(geoLevelRepository.findByCode("001")).thenReturn(Optional.of(GeoLevel.builder().code("001").name("Lahore").build()));

        // Act
        UserResponse response = userService.login(new LoginRequest("field01", "bcdfgh"));

        // Assert
        assertEquals(2L, response.getId());
        assertEquals("Lahore", response.getRegion());
    }

    @Test
    void login_withWrongPassword_isUnauthorized() {
        User user = User.builder().id(2L).username("field01").password(passwordEncoder.encode("bcdfgh")).isActive(true).build();
        when(userRepository.findByUsername("field01")).thenReturn(Optional.of(user));

        assertThrows(UnauthorizedException.class, () -> userService.login(new LoginRequest("field01", "zzzzzz")));
    }

    @Test
    void login_unknownOrInactiveUser_isUnauthorized() {
        User inactive = User.builder().id(4L).username("gone").password(passwordEncoder.encode("bcdfgh")).isActive(false).build();
        when(userRepository.findByUsername("nobody")).thenReturn(Optional.empty());
        when(userRepository.findByUsername("gone")).thenReturn(Optional.of(inactive));

        assertThrows(UnauthorizedException.class, () -> userService.login(new LoginRequest("nobody", "bcdfgh")));
        assertThrows(UnauthorizedException.class, () -> userService.login(new LoginRequest("gone", "bcdfgh")));
    }

    @Test
    void update_changesOnlySuppliedFields() {
        // Arrange
        User user = User.builder().id(2L).username("field01").password("hash").roles("surveyor")
                .isMobileUser(true).isActive(true).build();
        when(userRepository.findById(2L)).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);

        // Act
        UserResponse response = userService.update(2L, UserUpdateRequest.builder().isActive(false).build());

        // Assert
        assertFalse(response.getIsActive());
        assertEquals("surveyor", response.getRoles());
        assertEquals("hash", user.getPassword());
    }

    @Test
    void delete_unknownUser_isNotFound() {
        when(userRepository.existsById(9L)).thenReturn(false);

        assertThrows(ResourceNotFoundException.class, () -> userService.delete(9L));
    }
}
