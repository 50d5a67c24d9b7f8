package se.artisan_be.mapper;

import org.springframework.stereotype.Component;
import se.artisan_be.dto.response.ArtisanResponse;
import se.artisan_be.dto.response.ImageResponse;
import se.artisan_be.dto.response.LoanResponse;
import se.artisan_be.dto.response.MachineResponse;
import se.artisan_be.dto.response.TrainingResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static se.artisan_be.util.RowValues.*;

/**
 * Converts {@code artisans_view} rows into responses.
 */
@Component
public class ArtisanMapper {

    public ArtisanResponse toResponse(Map<String, Object> row) {
        return ArtisanResponse.builder()
                .id(asLong(row, "id"))
                .name(asString(row, "name"))
                .fatherName(asString(row, "father_name"))
                .cnic(asString(row, "cnic"))
                .gender(asString(row, "gender"))
                .dateOfBirth(asLocalDate(row, "date_of_birth"))
                .contactNo(asString(row, "contact_no"))
                .email(asString(row, "email"))
                .address(asString(row, "address"))
                .tehsilId(asLong(row, "tehsil_id"))
                .tehsilName(asString(row, "tehsil_name"))
                .districtName(asString(row, "district_name"))
                .divisionName(asString(row, "division_name"))
                .educationLevelId(asLong(row, "education_level_id"))
                .educationName(asString(row, "education_name"))
                .dependentsCount(asInteger(row, "dependents_count"))
                .profilePicture(asString(row, "profile_picture"))
                .ntn(asString(row, "ntn"))
                .skillId(asLong(row, "skill_id"))
                .skillName(asString(row, "skill_name"))
                .categoryName(asString(row, "category_name"))
                .craftName(asString(row, "craft_name"))
                .majorProduct(asString(row, "major_product"))
                .experience(asInteger(row, "experience"))
                .avgMonthlyIncome(asInteger(row, "avg_monthly_income"))
                .employmentTypeId(asLong(row, "employment_type_id"))
                .employmentType(asString(row, "employment_type"))
                .rawMaterial(asString(row, "raw_material"))
                .loanStatus(asBoolean(row, "loan_status"))
                .hasMachinery(asBoolean(row, "has_machinery"))
                .hasTraining(asBoolean(row, "has_training"))
                .inheritedSkills(asBoolean(row, "inherited_skills"))
                .financialAssistance(asBoolean(row, "financial_assistance"))
                .technicalAssistance(asBoolean(row, "technical_assistance"))
                .comments(asString(row, "comments"))
                .latitude(asDouble(row, "latitude"))
                .longitude(asDouble(row, "longitude"))
                .userId(asLong(row, "user_id"))
                .isActive(asBoolean(row, "is_active"))
                .createdAt(asLocalDateTime(row, "created_at"))
                .updatedAt(asLocalDateTime(row, "updated_at"))
                .build();
    }

    /**
     * Folds the flattened join rows of one artisan back into nested collections, de-duplicating
     * each child by id. Empty collections stay null so they are omitted from the JSON.
     */
    public ArtisanResponse toDetail(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return null;
        }
        ArtisanResponse artisan = toResponse(rows.get(0));

        Map<Long, TrainingResponse> trainings = new LinkedHashMap<>();
        Map<Long, LoanResponse> loans = new LinkedHashMap<>();
        Map<Long, MachineResponse> machines = new LinkedHashMap<>();
        Map<Long, ImageResponse> productImages = new LinkedHashMap<>();
        Map<Long, ImageResponse> shopImages = new LinkedHashMap<>();

        for (Map<String, Object> row : rows) {
            Long trainingId = asLong(row, "training_id");
            if (trainingId != null) {
                trainings.computeIfAbsent(trainingId, id -> TrainingResponse.builder()
                        .id(id)
                        .title(asString(row, "training_title"))
                        .duration(asString(row, "training_duration"))
                        .organization(asString(row, "training_organization"))
                        .build());
            }
            Long loanId = asLong(row, "loan_id");
            if (loanId != null) {
                loans.computeIfAbsent(loanId, id -> LoanResponse.builder()
                        .id(id)
                        .amount(asDecimal(row, "loan_amount"))
                        .date(asLocalDate(row, "loan_date"))
                        .loanType(asString(row, "loan_type"))
                        .lenderName(asString(row, "loan_lender_name"))
                        .build());
            }
            Long machineId = asLong(row, "machine_id");
            if (machineId != null) {
                machines.computeIfAbsent(machineId, id -> MachineResponse.builder()
                        .id(id)
                        .title(asString(row, "machine_title"))
                        .size(asString(row, "machine_size"))
                        .numberOfMachines(asInteger(row, "machine_count"))
                        .build());
            }
            Long productImageId = asLong(row, "product_image_id");
            if (productImageId != null) {
                productImages.computeIfAbsent(productImageId,
                        id -> new ImageResponse(id, asString(row, "product_image_path")));
            }
            Long shopImageId = asLong(row, "shop_image_id");
            if (shopImageId != null) {
                shopImages.computeIfAbsent(shopImageId,
                        id -> new ImageResponse(id, asString(row, "shop_image_path")));
            }
        }

        artisan.setTrainings(nullIfEmpty(trainings));
        artisan.setLoans(nullIfEmpty(loans));
        artisan.setMachines(nullIfEmpty(machines));
        artisan.setProductImages(nullIfEmpty(productImages));
        artisan.setShopImages(nullIfEmpty(shopImages));
        return artisan;
    }

    private static <T> List<T> nullIfEmpty(Map<Long, T> values) {
        return values.isEmpty() ? null : new ArrayList<>(values.values());
    }
}
