package se.artisan_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
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

import java.security.SecureRandom;
import java.util.List;
import java.util.Map;

import static se.artisan_be.util.RowValues.*;

@Service
@Slf4j
public class UserService {

    static final String PASSWORD_ALPHABET = "bcdfghjklmnpqrstvwxyz";
    static final int PASSWORD_LENGTH = 6;

    private static final String LIST_QUERY = """
            SELECT u.id, u.username, u.roles, u.geo_level_code, u.is_mobile_user, u.is_active, u.user_id,
                   u.created_at, g.name AS region,
                   (SELECT COUNT(*) FROM artisans a WHERE a.user_id = u.id AND a.is_active = TRUE) AS number_of_artisans
            FROM users u
            LEFT JOIN geo_level g ON g.code = u.geo_level_code
            ORDER BY u.id""";

    private final UserRepository userRepository;
    private final GeoLevelRepository geoLevelRepository;
    private final PasswordEncoder passwordEncoder;
    private final SqlClient sqlClient;
    private final SecureRandom random = new SecureRandom();

    public UserService(UserRepository userRepository,
                       GeoLevelRepository geoLevelRepository,
                       PasswordEncoder passwordEncoder,
                       SqlClient sqlClient) {
        this.userRepository = userRepository;
        this.geoLevelRepository = geoLevelRepository;
        this.passwordEncoder = passwordEncoder;
        this.sqlClient = sqlClient;
    }

    public List<UserResponse> findAll() {
        return sqlClient.queryAll(LIST_QUERY).stream()
                .map(this::convertToDTO)
                .toList();
    }

    /**
     * Creates the account with a generated password. Only the bcrypt hash is stored; the clear
     * password is handed back in the response and nowhere else.
     */
    @Transactional
    public UserRegistrationResponse register(UserRegisterRequest request) {
        if (userRepository.existsByUsername(request.getUsername())) {
            throw new DuplicateResourceException("Username '" + request.getUsername() + "' is already taken");
        }
        String password = generatePassword();
        User user = User.builder()
                .username(request.getUsername())
                .password(passwordEncoder.encode(password))
                .roles(request.getRoles())
                .geoLevelCode(request.getGeoLevelCode())
                .isMobileUser(Boolean.TRUE.equals(request.getIsMobileUser()))
                .isActive(true)
                .userId(request.getUserId())
                .build();
        User saved = userRepository.save(user);
        log.info("User {} registered as '{}'", saved.getId(), saved.getUsername());
        return UserRegistrationResponse.builder()
                .id(saved.getId())
                .username(saved.getUsername())
                .generatedPassword(password)
                .build();
    }

    public UserResponse login(LoginRequest request) {
        User user = userRepository.findByUsername(request.getUsername())
                .orElseThrow(() -> {
                    log.warn("Login failed, unknown user '{}'", request.getUsername());
                    return new UnauthorizedException("Invalid username or password");
                });
        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("Login refused for inactive user '{}'", user.getUsername());
            throw new UnauthorizedException("Account is inactive");
        }
        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.warn("Login failed, incorrect password for '{}'", user.getUsername());
            throw new UnauthorizedException("Invalid username or password");
        }
        log.info("User {} logged in", user.getId());
        return convertToDTO(user);
    }

    @Transactional
    public UserResponse update(Long id, UserUpdateRequest request) {
        User user = userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", id));

        if (request.getUsername() != null && !request.getUsername().equals(user.getUsername())) {
            if (userRepository.existsByUsername(request.getUsername())) {
                throw new DuplicateResourceException("Username '" + request.getUsername() + "' is already taken");
            }
            user.setUsername(request.getUsername());
        }
        if (request.getRoles() != null) {
            user.setRoles(request.getRoles());
        }
        if (request.getGeoLevelCode() != null) {
            user.setGeoLevelCode(request.getGeoLevelCode());
        }
        if (request.getIsMobileUser() != null) {
            user.setIsMobileUser(request.getIsMobileUser());
        }
        if (request.getIsActive() != null) {
            user.setIsActive(request.getIsActive());
        }
        if (request.getUserId() != null) {
            user.setUserId(request.getUserId());
        }
        log.info("User {} updated", id);
        return convertToDTO(userRepository.save(user));
    }

    @Transactional
    public void delete(Long id) {
        if (!userRepository.existsById(id)) {
            throw new ResourceNotFoundException("User", id);
        }
        userRepository.deleteById(id);
        log.info("User {} deleted", id);
    }

    String generatePassword() {
        StringBuilder password = new StringBuilder(PASSWORD_LENGTH);
        for (int i = 0; i < PASSWORD_LENGTH; i++) {
            password.append(PASSWORD_ALPHABET.charAt(random.nextInt(PASSWORD_ALPHABET.length())));
        }
        return password.toString();
    }

    private UserResponse convertToDTO(User user) {
        String region = user.getGeoLevelCode() == null ? null
                : geoLevelRepository.findByCode(user.getGeoLevelCode()).map(GeoLevel::getName).orElse(null);
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .roles(user.getRoles())
                .geoLevelCode(user.getGeoLevelCode())
                .region(region)
                .isMobileUser(user.getIsMobileUser())
                .isActive(user.getIsActive())
                .userId(user.getUserId())
                .createdAt(user.getCreatedAt())
                .build();
    }

    private UserResponse convertToDTO(Map<String, Object> row) {
        return UserResponse.builder()
                .id(asLong(row, "id"))
                .username(asString(row, "username"))
                .roles(asString(row, "roles"))
                .geoLevelCode(asString(row, "geo_level_code"))
                .region(asString(row, "region"))
                .isMobileUser(asBoolean(row, "is_mobile_user"))
                .isActive(asBoolean(row, "is_active"))
                .userId(asLong(row, "user_id"))
                .numberOfArtisans(numberOrZero(row, "number_of_artisans").longValue())
                .createdAt(asLocalDateTime(row, "created_at"))
                .build();
    }
}
