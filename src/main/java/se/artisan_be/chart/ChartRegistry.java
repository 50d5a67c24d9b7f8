package se.artisan_be.chart;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every chart the dashboard can request, keyed by its URL name.
 */
@Component
public class ChartRegistry {

    private static final String COUNT = "COUNT(*) AS total";
    private static final String AVERAGE_INCOME =
            "ROUND(AVG(CAST(a.avg_monthly_income AS DOUBLE PRECISION)), 2) AS average";
    private static final String AGE =
            "(EXTRACT(YEAR FROM CURRENT_DATE) - EXTRACT(YEAR FROM a.date_of_birth))";

    public static final Map<String, String> YES_NO_FIELDS = orderedMap(
            "loan_status", "a.loan_status",
            "has_machinery", "a.has_machinery",
            "has_training", "a.has_training",
            "inherited_skills", "a.inherited_skills",
            "financial_assistance", "a.financial_assistance",
            "technical_assistance", "a.technical_assistance");

    public static final Map<String, String> GROUPINGS = orderedMap(
            "skill", "a.skill_name",
            "craft", "a.craft_name",
            "category", "a.category_name");

    public static final List<Bin> AGE_BINS = List.of(
            new Bin("0-12", 12), new Bin("13-18", 18), new Bin("19-24", 24), new Bin("25-30", 30),
            new Bin("31-40", 40), new Bin("41-50", 50), new Bin("51-60", 60), new Bin("60+", null));
    public static final List<Bin> EXPERIENCE_BINS = List.of(
            new Bin("0-2", 2), new Bin("3-5", 5), new Bin("6-10", 10), new Bin("11-20", 20), new Bin("20+", null));
    public static final List<Bin> INCOME_BINS = List.of(
            new Bin("0-10000", 10000), new Bin("10001-25000", 25000), new Bin("25001-50000", 50000),
            new Bin("50001-100000", 100000), new Bin("100000+", null));
    public static final List<Bin> DEPENDENTS_BINS = List.of(
            new Bin("0-2", 2), new Bin("3-5", 5), new Bin("6+", null));

    private final Map<String, ChartDefinition> definitions = new LinkedHashMap<>();

    public ChartRegistry() {
        simple("gender", "Gender Distribution", "a.gender");
        simple("education", "Education Distribution", "a.education_name");
        simple("skill", "Skill Distribution", "a.skill_name");
        simple("craft", "Craft Distribution", "a.craft_name");
        simple("category", "Category Distribution", "a.category_name");
        simple("employment-type", "Employment Type Distribution", "a.employment_type");
        simple("division", "Division Distribution", "a.division_name");
        simple("district", "District Distribution", "a.district_name");
        simple("tehsil", "Tehsil Distribution", "a.tehsil_name");

        register(ChartDefinition.builder()
                .name("yes-no")
                .title("Yes/No Distribution")
                .select("{column} AS label, " + COUNT)
                .groupBy("{column}")
                .formatter(ChartFormatters.yesNoDistribution())
                .dynamicColumns(YES_NO_FIELDS)
                .build());

        register(ChartDefinition.builder()
                .name("income-by-skill")
                .title("Average Income by Skill")
                .select("a.skill_name AS label, " + AVERAGE_INCOME)
                .groupBy("a.skill_name")
                .orderBy("average DESC")
                .formatter(ChartFormatters.averageIncome())
                .build());

        binned("age", "Age Distribution", AGE, AGE_BINS, "a.date_of_birth");
        binned("experience", "Experience Distribution", "a.experience", EXPERIENCE_BINS, "a.experience");
        binned("income", "Income Distribution", "a.avg_monthly_income", INCOME_BINS, "a.avg_monthly_income");
        binned("dependents", "Dependents Distribution", "a.dependents_count", DEPENDENTS_BINS, "a.dependents_count");

        stacked("gender-by-tehsil", "Gender by Tehsil", "a.tehsil_name", "a.gender", "tehsil", null);
        stacked("skill-by-employment", "Skill by Employment Type", "a.skill_name", "a.employment_type", "skill", null);

        register(ChartDefinition.builder()
                .name("registrations-time")
                .title("Registrations Over Time")
                .select(monthlySelect())
                .where("a.created_at IS NOT NULL")
                .groupBy(monthlyGroupBy())
                .orderBy("reg_year, reg_month")
                .formatter(ChartFormatters.monthlySeries())
                .build());
        register(ChartDefinition.builder()
                .name("cumulative-registrations")
                .title("Cumulative Registrations")
                .select(monthlySelect())
                .where("a.created_at IS NOT NULL")
                .groupBy(monthlyGroupBy())
                .orderBy("reg_year, reg_month")
                .formatter(ChartFormatters.cumulativeSeries())
                .build());

        register(ChartDefinition.builder()
                .name("experience-vs-income")
                .title("Experience vs Income")
                .select("a.experience AS experience, a.avg_monthly_income AS income")
                .orderBy("a.id")
                .formatter(ChartFormatters.experienceVsIncome())
                .build());
        register(ChartDefinition.builder()
                .name("geographical")
                .title("Geographical Distribution")
                .select("a.latitude AS latitude, a.longitude AS longitude, a.name AS name, a.father_name AS father_name")
                .orderBy("a.id")
                .formatter(ChartFormatters.geographical())
                .build());

        register(ChartDefinition.builder()
                .name("distribution")
                .title("Distribution")
                .select("{column} AS label, " + COUNT)
                .groupBy("{column}")
                .orderBy("total DESC, label")
                .formatter(ChartFormatters.simpleDistribution())
                .dynamicColumns(GROUPINGS)
                .build());
        register(ChartDefinition.builder()
                .name("top-distribution")
                .title("Top 5")
                .select("{column} AS label, " + COUNT)
                .groupBy("{column}")
                .orderBy("total DESC, label")
                .limit(5)
                .formatter(ChartFormatters.simpleDistribution())
                .dynamicColumns(GROUPINGS)
                .build());
        register(ChartDefinition.builder()
                .name("average-income-by")
                .title("Average Income")
                .select("{column} AS label, " + AVERAGE_INCOME)
                .groupBy("{column}")
                .orderBy("average DESC")
                .formatter(ChartFormatters.averageIncome())
                .dynamicColumns(GROUPINGS)
                .build());
        stacked("distribution-by-employment", "Distribution by Employment Type",
                "{column}", "a.employment_type", "name", GROUPINGS);
    }

    public Optional<ChartDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Collection<ChartDefinition> all() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    private void register(ChartDefinition definition) {
        definitions.put(definition.getName(), definition);
    }

    private void simple(String name, String title, String column) {
        register(ChartDefinition.builder()
                .name(name)
                .title(title)
                .select(column + " AS label, " + COUNT)
                .groupBy(column)
                .orderBy("total DESC, label")
                .formatter(ChartFormatters.simpleDistribution())
                .build());
    }

    private void binned(String name, String title, String expression, List<Bin> bins, String sourceColumn) {
        String bucket = bucketCase(expression, bins, sourceColumn);
        List<String> labels = new ArrayList<>(bins.size());
        bins.forEach(bin -> labels.add(bin.getLabel()));
        register(ChartDefinition.builder()
                .name(name)
                .title(title)
                .select(bucket + " AS label, " + COUNT)
                .groupBy(bucket)
                .formatter(ChartFormatters.binned(labels))
                .build());
    }

    private void stacked(String name, String title, String primary, String secondary, String primaryKey,
                         Map<String, String> dynamicColumns) {
        register(ChartDefinition.builder()
                .name(name)
                .title(title)
                .select(primary + " AS label, " + secondary + " AS stack, " + COUNT)
                .groupBy(primary + ", " + secondary)
                .orderBy("label, stack")
                .formatter(ChartFormatters.stacked(primaryKey))
                .dynamicColumns(dynamicColumns)
                .build());
    }

    static String bucketCase(String expression, List<Bin> bins, String sourceColumn) {
        StringBuilder sql = new StringBuilder("CASE WHEN ").append(sourceColumn).append(" IS NULL THEN NULL");
        for (Bin bin : bins) {
            if (bin.getUpperInclusive() == null) {
                sql.append(" ELSE '").append(bin.getLabel()).append("'");
            } else {
                sql.append(" WHEN ").append(expression).append(" <= ").append(bin.getUpperInclusive())
                        .append(" THEN '").append(bin.getLabel()).append("'");
            }
        }
        return sql.append(" END").toString();
    }

    private static String monthlySelect() {
        return "EXTRACT(YEAR FROM a.created_at) AS reg_year, EXTRACT(MONTH FROM a.created_at) AS reg_month, " + COUNT;
    }

    private static String monthlyGroupBy() {
        return "EXTRACT(YEAR FROM a.created_at), EXTRACT(MONTH FROM a.created_at)";
    }

    private static Map<String, String> orderedMap(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
