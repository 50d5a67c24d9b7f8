package se.artisan_be.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;
import se.artisan_be.dto.request.ArtisanCreateRequest;
import se.artisan_be.dto.request.ArtisanDetailsRequest;
import se.artisan_be.dto.request.LoanRequest;
import se.artisan_be.dto.request.MachineRequest;
import se.artisan_be.dto.request.TrainingRequest;
import se.artisan_be.exception.BadRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Multipart submissions carry each section as a JSON string field next to the image parts.
 * This turns them into a validated {@link ArtisanCreateRequest}.
 */
@Component
public class ArtisanFormReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public ArtisanFormReader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public ArtisanCreateRequest read(String artisan, String trainings, String loans, String machines) {
        ArtisanCreateRequest request = ArtisanCreateRequest.builder()
                .artisan(parse("artisan", artisan, new TypeReference<ArtisanDetailsRequest>() { }))
                .trainings(parseList("trainings", trainings, new TypeReference<List<TrainingRequest>>() { }))
                .loans(parseList("loans", loans, new TypeReference<List<LoanRequest>>() { }))
                .machines(parseList("machines", machines, new TypeReference<List<MachineRequest>>() { }))
                .build();

        Set<ConstraintViolation<ArtisanCreateRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return request;
    }

    private <T> T parse(String field, String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Invalid JSON format in form data field '" + field + "': "
                    + e.getOriginalMessage());
        }
    }

    private <T> List<T> parseList(String field, String json, TypeReference<List<T>> type) {
        List<T> values = parse(field, json, type);
        return values == null ? new ArrayList<>() : values;
    }
}
