package se.artisan_be.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.artisan_be.dto.request.ArtisanCreateRequest;
import se.artisan_be.exception.BadRequestException;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ArtisanFormReaderTest {

    private static final String ARTISAN = """
            {"name": "Amina", "father_name": "Rashid", "cnic": "3520212345671", "gender": "Female",
             "date_of_birth": "1990-04-12", "user_id": 7}""";

    private ValidatorFactory validatorFactory;
    private ArtisanFormReader reader;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        validatorFactory = Validation.buildDefaultValidatorFactory();
        reader = new ArtisanFormReader(objectMapper, validatorFactory.getValidator());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void read_parsesEverySection() {
        ArtisanCreateRequest request = reader.read(ARTISAN,
                "[{\"title\": \"Stitching\", \"duration\": \"3 months\"}]",
                "[{\"amount\": 25000, \"date\": \"2023-05-01\", \"loan_type\": \"Microfinance\"}]",
                null);

        assertEquals("Rashid", request.getArtisan().getFatherName());
        assertEquals(LocalDate.of(1990, 4, 12), request.getArtisan().getDateOfBirth());
        assertThat(request.getTrainings()).hasSize(1);
        assertEquals("Microfinance", request.getLoans().get(0).getLoanType());
        assertThat(request.getMachines()).isEmpty();
    }

    @Test
    void read_malformedJson_namesTheField() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> reader.read(ARTISAN, "[{\"title\": ", null, null));

        assertThat(ex.getMessage()).contains("'trainings'");
    }

    @Test
    void read_invalidCnic_isRejected() {
        String artisan = ARTISAN.replace("3520212345671", "35202-1234567-1");

        ConstraintViolationException ex = assertThrows(ConstraintViolationException.class,
                () -> reader.read(artisan, null, null, null));

        assertThat(ex.getConstraintViolations())
                .anyMatch(violation -> violation.getPropertyPath().toString().equals("artisan.cnic"));
    }

    @Test
    void read_missingArtisan_isRejected() {
        assertThrows(ConstraintViolationException.class, () -> reader.read(null, "[]", null, null));
    }
}
