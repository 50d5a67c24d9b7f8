package se.artisan_be.chart;

import org.junit.jupiter.api.Test;
import se.artisan_be.dto.response.ChartPoint;
import se.artisan_be.dto.response.MonthlyCount;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChartFormattersTest {

    @Test
    @SuppressWarnings("unchecked")
    void simpleDistribution_titleCasesLabelsAndReportsUnknown() {
        List<Map<String, Object>> rows = List.of(row("label", "female", "total", 3L), row("label", null, "total", 1L));

        List<ChartPoint> points = (List<ChartPoint>) ChartFormatters.simpleDistribution().format(rows);

        assertEquals(List.of(new ChartPoint("Female", 3L), new ChartPoint("Unknown", 1L)), points);
    }

    @Test
    @SuppressWarnings("unchecked")
    void yesNoDistribution_mapsBooleans() {
        List<Map<String, Object>> rows = List.of(
                row("label", true, "total", 4L),
                row("label", false, "total", 2L),
                row("label", null, "total", 1L));

        List<ChartPoint> points = (List<ChartPoint>) ChartFormatters.yesNoDistribution().format(rows);

        assertEquals(List.of(new ChartPoint("Yes", 4L), new ChartPoint("No", 2L), new ChartPoint("Unknown", 1L)),
                points);
    }

    @Test
    @SuppressWarnings("unchecked")
    void binned_zeroFillsAndKeepsDeclaredOrder() {
        List<Map<String, Object>> rows = List.of(row("label", "6+", "total", 2L), row("label", "0-2", "total", 5L));

        List<ChartPoint> points = (List<ChartPoint>) ChartFormatters.binned(List.of("0-2", "3-5", "6+")).format(rows);

        assertEquals(List.of(new ChartPoint("0-2", 5L), new ChartPoint("3-5", 0L), new ChartPoint("6+", 2L)), points);
    }

    @Test
    @SuppressWarnings("unchecked")
    void binned_appendsUnknownOnlyWhenPresent() {
        List<Map<String, Object>> rows = List.of(row("label", null, "total", 2L));

        List<ChartPoint> points = (List<ChartPoint>) ChartFormatters.binned(List.of("0-2", "3-5")).format(rows);

        assertEquals(3, points.size());
        assertEquals(new ChartPoint("Unknown", 2L), points.get(2));
    }

    @Test
    @SuppressWarnings("unchecked")
    void stacked_fillsEveryStackKeyWithZero() {
        List<Map<String, Object>> rows = List.of(
                row("label", "Lahore City", "stack", "Male", "total", 3L),
                row("label", "Kasur", "stack", "Female", "total", 1L),
                row("label", null, "stack", "Male", "total", 9L));

        List<Map<String, Object>> result = (List<Map<String, Object>>) ChartFormatters.stacked("tehsil").format(rows);

        assertEquals(2, result.size());
        assertEquals("Lahore City", result.get(0).get("tehsil"));
        assertEquals(3L, result.get(0).get("Male"));
        assertEquals(0L, result.get(0).get("Female"));
        assertEquals(0L, result.get(1).get("Male"));
        assertEquals(1L, result.get(1).get("Female"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void cumulativeSeries_isRunningTotal() {
        List<Map<String, Object>> rows = List.of(
                row("reg_year", 2024, "reg_month", 1, "total", 2L),
                row("reg_year", 2024, "reg_month", 2, "total", 3L),
                row("reg_year", 2024, "reg_month", 3, "total", 1L));

        List<MonthlyCount> series = (List<MonthlyCount>) ChartFormatters.cumulativeSeries().format(rows);

        assertEquals(List.of(2L, 5L, 6L), series.stream().map(MonthlyCount::getCount).toList());
        assertEquals("2024-01", series.get(0).getMonth());
    }

    @Test
    @SuppressWarnings("unchecked")
    void monthlySeries_keepsCountsPerMonth() {
        List<Map<String, Object>> rows = List.of(
                row("reg_year", 2023, "reg_month", 12, "total", 7L),
                row("reg_year", 2024, "reg_month", 1, "total", 3L));

        List<MonthlyCount> series = (List<MonthlyCount>) ChartFormatters.monthlySeries().format(rows);

        assertEquals(List.of(new MonthlyCount("2023-12", 7L), new MonthlyCount("2024-01", 3L)), series);
    }

    @Test
    void titleCase_handlesBlankAndMixedCase() {
        assertEquals("Unknown", ChartFormatters.titleCase(null));
        assertEquals("Unknown", ChartFormatters.titleCase("  "));
        assertEquals("Self employed", ChartFormatters.titleCase("SELF EMPLOYED"));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
