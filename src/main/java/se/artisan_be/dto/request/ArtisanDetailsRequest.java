package se.artisan_be.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * The artisan row itself. Used for create and for the whole-row overwrite on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ArtisanDetailsRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Father name is required")
    private String fatherName;

    @Pattern(regexp = "\\d{13}", message = "CNIC must be exactly 13 digits")
    private String cnic;

    @Pattern(regexp = "Male|Female|Other|Transgender", message = "Gender must be Male, Female, Other or Transgender")
    private String gender;

    @Past(message = "Date of birth must be in the past")
    private LocalDate dateOfBirth;

    @Pattern(regexp = "\\d{11}", message = "Contact number must be exactly 11 digits")
    private String contactNo;

    @Email(message = "Email must be valid")
    private String email;

    private String address;
    private Long tehsilId;
    private Long educationLevelId;

    @PositiveOrZero(message = "Dependents count cannot be negative")
    private Integer dependentsCount;

    private String profilePicture;
    private String ntn;
    private Long skillId;
    private String majorProduct;

    @PositiveOrZero(message = "Experience cannot be negative")
    private Integer experience;

    @PositiveOrZero(message = "Average monthly income cannot be negative")
    private Integer avgMonthlyIncome;

    private Long employmentTypeId;
    private String rawMaterial;
    private Boolean loanStatus;
    private Boolean hasMachinery;
    private Boolean hasTraining;
    private Boolean inheritedSkills;
    private Boolean financialAssistance;
    private Boolean technicalAssistance;
    private String comments;

    @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
    private Double latitude;

    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    private Double longitude;

    private Long userId;
}
