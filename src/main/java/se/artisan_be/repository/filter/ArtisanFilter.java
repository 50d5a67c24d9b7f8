package se.artisan_be.repository.filter;

import lombok.Getter;

/**
 * Request parameters that may narrow artisan listings and charts, in the order they are applied.
 * Only the columns named here ever reach generated SQL.
 */
@Getter
public enum ArtisanFilter {
    USER_ID("user_id", "user_id", FilterKind.IDENTIFIER),
    DIVISION("division", "division_name", FilterKind.CATEGORICAL),
    DISTRICT("district", "district_name", FilterKind.CATEGORICAL),
    TEHSIL("tehsil", "tehsil_name", FilterKind.CATEGORICAL),
    GENDER("gender", "gender", FilterKind.CATEGORICAL),
    CRAFT("craft", "craft_name", FilterKind.CATEGORICAL),
    CATEGORY("category", "category_name", FilterKind.CATEGORICAL),
    SKILL("skill", "skill_name", FilterKind.CATEGORICAL),
    EDUCATION("education", "education_name", FilterKind.CATEGORICAL),
    RAW_MATERIAL("raw_material", "raw_material", FilterKind.CATEGORICAL),
    EMPLOYMENT_TYPE("employment_type", "employment_type", FilterKind.CATEGORICAL),
    INHERITED_SKILLS("inherited_skills", "inherited_skills", FilterKind.FLAG),
    HAS_MACHINERY("has_machinery", "has_machinery", FilterKind.FLAG),
    HAS_TRAINING("has_training", "has_training", FilterKind.FLAG),
    LOAN_STATUS("loan_status", "loan_status", FilterKind.FLAG),
    FINANCIAL_ASSISTANCE("financial_assistance", "financial_assistance", FilterKind.FLAG),
    TECHNICAL_ASSISTANCE("technical_assistance", "technical_assistance", FilterKind.FLAG),
    AVG_MONTHLY_INCOME("avg_monthly_income", "avg_monthly_income", FilterKind.NUMERICAL),
    DEPENDENTS_COUNT("dependents_count", "dependents_count", FilterKind.NUMERICAL),
    EXPERIENCE("experience", "experience", FilterKind.NUMERICAL);

    private final String parameter;
    private final String column;
    private final FilterKind kind;

    ArtisanFilter(String parameter, String column, FilterKind kind) {
        this.parameter = parameter;
        this.column = column;
        this.kind = kind;
    }
}
