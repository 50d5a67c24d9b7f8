package se.artisan_be.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import se.artisan_be.dto.response.AverageIncomePoint;
import se.artisan_be.dto.response.ChartPoint;
import se.artisan_be.dto.response.DashboardResponse;
import se.artisan_be.dto.response.MonthlyCount;
import se.artisan_be.service.ChartService;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
class ChartQueriesTest {

    @Autowired
    private ChartService chartService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        for (String table : List.of("trainings", "loans", "machines", "product_images", "shop_images",
                "artisans", "techniques", "categories", "crafts")) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
        Long craftId = insert("INSERT INTO crafts (name) VALUES (?)", "Textile");
        Long categoryId = insert("INSERT INTO categories (name, craft_id) VALUES (?, ?)", "Embroidery", craftId);
        Long skillId = insert("INSERT INTO techniques (name, category_id) VALUES (?, ?)", "Phulkari", categoryId);

        artisan("Amina", "Female", 8000, true, 10L, skillId, true, null);
        artisan("Sana", "Female", 30000, false, 11L, skillId, true, null);
        artisan("Bilal", "Male", null, null, 10L, null, true, "2020-01-15 10:00:00");
        artisan("Hidden", "Male", 90000, true, 12L, skillId, false, null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void gender_countsActiveArtisansWithTitleCasedLabels() {
        List<ChartPoint> points = (List<ChartPoint>) chartService.getChart("gender", null, Map.of());

        assertThat(points)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactly(tuple("Female", 2L), tuple("Male", 1L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void yesNo_mapsFlagsAndUnknown() {
        List<ChartPoint> points = (List<ChartPoint>) chartService.getChart("yes-no", "has_training", Map.of());

        assertThat(points)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactlyInAnyOrder(tuple("Yes", 1L), tuple("No", 1L), tuple("Unknown", 1L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void income_isBinnedInDeclaredOrder() {
        List<ChartPoint> points = (List<ChartPoint>) chartService.getChart("income", null, Map.of());

        assertThat(points)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactly(
                        tuple("0-10000", 1L),
                        tuple("10001-25000", 0L),
                        tuple("25001-50000", 1L),
                        tuple("50001-100000", 0L),
                        tuple("100000+", 0L),
                        tuple("Unknown", 1L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void filters_narrowTheChart() {
        List<ChartPoint> points = (List<ChartPoint>) chartService.getChart("gender", null, Map.of("avg_monthly_income", "0-10000"));

        assertThat(points)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactly(tuple("Female", 1L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void malformedIdAndFlagFilters_areIgnored() {
        List<ChartPoint> byUser = (List<ChartPoint>) chartService.getChart("gender", null, Map.of("user_id", "abc"));
        List<ChartPoint> byFlag = (List<ChartPoint>) chartService.getChart("gender", null, Map.of("has_training", "maybe"));

        assertThat(byUser)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactly(tuple("Female", 2L), tuple("Male", 1L));
        assertThat(byFlag).isEqualTo(byUser);
        assertThat(chartService.getDashboard(Map.of("user_id", "abc")).getTotalActiveArtisans()).isEqualTo(3L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void flagFilter_acceptsYesSpelling() {
        List<ChartPoint> points = (List<ChartPoint>) chartService.getChart("gender", null, Map.of("has_training", "Yes"));

        assertThat(points)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactly(tuple("Female", 1L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void distribution_groupsByCraftWithUnknownForMissingSkill() {
        List<ChartPoint> points = (List<ChartPoint>) chartService.getChart("distribution", "craft", Map.of());

        assertThat(points)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactly(tuple("Textile", 2L), tuple("Unknown", 1L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void topDistribution_groupsBySkillAndHonoursFilters() {
        List<ChartPoint> points = (List<ChartPoint>) chartService.getChart("top-distribution", "skill",
                Map.of("gender", "Female"));

        assertThat(points)
                .extracting(ChartPoint::getName, point -> point.getValue().longValue())
                .containsExactly(tuple("Phulkari", 2L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void averageIncomeBy_averagesPerCategory() {
        List<AverageIncomePoint> points = (List<AverageIncomePoint>) chartService.getChart("average-income-by",
                "category", Map.of());

        assertThat(points)
                .extracting(AverageIncomePoint::getName, point -> point.getAvgIncome().doubleValue())
                .containsExactlyInAnyOrder(tuple("Embroidery", 19000.0), tuple("Unknown", 0.0));
    }

    @Test
    @SuppressWarnings("unchecked")
    void cumulativeRegistrations_endAtTheActiveTotal() {
        List<MonthlyCount> series = (List<MonthlyCount>) chartService.getChart("cumulative-registrations", null, Map.of());

        assertThat(series.get(0).getMonth()).isEqualTo("2020-01");
        assertThat(series.get(series.size() - 1).getCount()).isEqualTo(3L);
    }

    @Test
    void dashboard_countsActiveArtisansRegionsAndThisMonth() {
        DashboardResponse dashboard = chartService.getDashboard(Map.of());

        assertThat(dashboard.getTotalActiveArtisans()).isEqualTo(3L);
        assertThat(dashboard.getRegionsCovered()).isEqualTo(2L);
        assertThat(dashboard.getNewRegistrationsThisMonth()).isEqualTo(2L);
    }

    @Test
    void allCharts_runEveryReportAgainstTheDatabase() {
        Map<String, Object> report = chartService.getAllCharts(Map.of());

        assertThat(report).hasSize(21);
        assertThat(report).containsKeys("genderDistribution", "ageDistribution", "geographicalDistribution");
        assertThat(report.values()).doesNotContainNull();
    }

    private void artisan(String name, String gender, Integer income, Boolean hasTraining, Long tehsilId,
                         Long skillId, boolean active, String createdAt) {
        jdbcTemplate.update("""
                        INSERT INTO artisans (name, father_name, gender, date_of_birth, avg_monthly_income, experience,
                                              has_training, tehsil_id, skill_id, latitude, longitude, is_active, created_at)
                        VALUES (?, 'Rashid', ?, DATE '1990-04-12', ?, 4, ?, ?, ?, 31.5, 74.3, ?,
                                COALESCE(CAST(? AS TIMESTAMP), CURRENT_TIMESTAMP))""",
                name, gender, income, hasTraining, tehsilId, skillId, active, createdAt);
    }

    private Long insert(String sql, Object... params) {
        jdbcTemplate.update(sql, params);
        return jdbcTemplate.queryForObject("SELECT MAX(id) FROM " + sql.split("\\s+")[2], Long.class);
    }
}
