package se.artisan_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Artisan row with resolved reference names. Child collections are populated only on the
 * single-artisan read and are left out of the JSON when empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ArtisanResponse {
    private Long id;
    private String name;
    private String fatherName;
    private String cnic;
    private String gender;
    private LocalDate dateOfBirth;
    private String contactNo;
    private String email;
    private String address;
    private Long tehsilId;
    private String tehsilName;
    private String districtName;
    private String divisionName;
    private Long educationLevelId;
    private String educationName;
    private Integer dependentsCount;
    private String profilePicture;
    private String ntn;
    private Long skillId;
    private String skillName;
    private String categoryName;
    private String craftName;
    private String majorProduct;
    private Integer experience;
    private Integer avgMonthlyIncome;
    private Long employmentTypeId;
    private String employmentType;
    private String rawMaterial;
    private Boolean loanStatus;
    private Boolean hasMachinery;
    private Boolean hasTraining;
    private Boolean inheritedSkills;
    private Boolean financialAssistance;
    private Boolean technicalAssistance;
    private String comments;
    private Double latitude;
    private Double longitude;
    private Long userId;
    private Boolean isActive;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<TrainingResponse> trainings;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<LoanResponse> loans;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<MachineResponse> machines;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<ImageResponse> productImages;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<ImageResponse> shopImages;
}
