package se.artisan_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import se.artisan_be.chart.ChartDefinition;
import se.artisan_be.chart.ChartRegistry;
import se.artisan_be.dto.response.DashboardResponse;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.repository.filter.FilterQueryBuilder;
import se.artisan_be.repository.jdbc.SqlClient;
import se.artisan_be.util.RowValues;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
@Slf4j
public class ChartService {

    /** Reports bundled into the combined response, keyed as the dashboard expects them. */
    static final List<Report> ALL_REPORTS = List.of(
            new Report("genderDistribution", "gender", null),
            new Report("educationDistribution", "education", null),
            new Report("skillDistribution", "skill", null),
            new Report("employmentTypeDistribution", "employment-type", null),
            new Report("divisionDistribution", "division", null),
            new Report("districtDistribution", "district", null),
            new Report("tehsilDistribution", "tehsil", null),
            new Report("loanStatusDistribution", "yes-no", "loan_status"),
            new Report("hasMachineryDistribution", "yes-no", "has_machinery"),
            new Report("hasTrainingDistribution", "yes-no", "has_training"),
            new Report("averageIncomeBySkill", "income-by-skill", null),
            new Report("ageDistribution", "age", null),
            new Report("experienceDistribution", "experience", null),
            new Report("incomeDistribution", "income", null),
            new Report("dependentsDistribution", "dependents", null),
            new Report("genderByTehsil", "gender-by-tehsil", null),
            new Report("skillByEmploymentType", "skill-by-employment", null),
            new Report("registrationsOverTime", "registrations-time", null),
            new Report("cumulativeRegistrations", "cumulative-registrations", null),
            new Report("experienceVsIncome", "experience-vs-income", null),
            new Report("geographicalDistribution", "geographical", null));

    private final ChartRegistry chartRegistry;
    private final SqlClient sqlClient;
    private final Executor chartExecutor;
    private final Clock clock;

    public ChartService(ChartRegistry chartRegistry,
                        SqlClient sqlClient,
                        @Qualifier("chartExecutor") Executor chartExecutor,
                        Clock clock) {
        this.chartRegistry = chartRegistry;
        this.sqlClient = sqlClient;
        this.chartExecutor = chartExecutor;
        this.clock = clock;
    }

    public Object getChart(String name, String groupBy, Map<String, String> filters) {
        ChartDefinition definition = chartRegistry.find(name)
                .orElseThrow(() -> new ResourceNotFoundException("Chart '" + name + "' not found"));
        String column = definition.resolveColumn(groupBy);
        log.debug("Running chart '{}' grouped by {}", definition.getTitle(), column == null ? "nothing" : column);

        StringBuilder filterClause = new StringBuilder();
        List<Object> params = new ArrayList<>();
        FilterQueryBuilder.applyFilters(filterClause, params, "a", filters);

        String sql = definition.toSql(column, filterClause.toString());
        List<Map<String, Object>> rows = sqlClient.queryAll(sql, params.toArray());
        return definition.getFormatter().format(rows);
    }

    public DashboardResponse getDashboard(Map<String, String> filters) {
        StringBuilder filterClause = new StringBuilder();
        List<Object> filterParams = new ArrayList<>();
        FilterQueryBuilder.applyFilters(filterClause, filterParams, "a", filters);

        String scope = " FROM artisans_view a WHERE a.is_active = TRUE" + filterClause;
        String sql = "SELECT"
                + " (SELECT COUNT(*)" + scope + ") AS total_active_artisans,"
                + " (SELECT COUNT(DISTINCT a.tehsil_id)" + scope + ") AS regions_covered,"
                + " (SELECT COUNT(*)" + scope + " AND a.created_at >= ?) AS new_registrations_this_month";

        List<Object> params = new ArrayList<>();
        params.addAll(filterParams);
        params.addAll(filterParams);
        params.addAll(filterParams);
        params.add(Timestamp.valueOf(LocalDate.now(clock).withDayOfMonth(1).atStartOfDay()));

        Map<String, Object> row = sqlClient.queryOne(sql, params.toArray()).orElse(Collections.emptyMap());
        return DashboardResponse.builder()
                .totalActiveArtisans(RowValues.numberOrZero(row, "total_active_artisans").longValue())
                .regionsCovered(RowValues.numberOrZero(row, "regions_covered").longValue())
                .newRegistrationsThisMonth(RowValues.numberOrZero(row, "new_registrations_this_month").longValue())
                .build();
    }

    /**
     * Runs every bundled report concurrently. Any failing report fails the whole response.
     */
    public Map<String, Object> getAllCharts(Map<String, String> filters) {
        log.info("Building combined chart report with filters {}", filters);
        Map<String, CompletableFuture<Object>> pending = new LinkedHashMap<>();
        for (Report report : ALL_REPORTS) {
            pending.put(report.key(), CompletableFuture.supplyAsync(
                    () -> getChart(report.chart(), report.groupBy(), filters), chartExecutor));
        }

        try {
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            // allOf completes only after every query has finished, so nothing is left running
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        pending.forEach((key, future) -> result.put(key, future.join()));
        return result;
    }

    record Report(String key, String chart, String groupBy) {
    }
}
