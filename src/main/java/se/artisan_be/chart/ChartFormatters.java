package se.artisan_be.chart;

import se.artisan_be.dto.response.AverageIncomePoint;
import se.artisan_be.dto.response.ChartPoint;
import se.artisan_be.dto.response.GeoPoint;
import se.artisan_be.dto.response.MonthlyCount;
import se.artisan_be.dto.response.ScatterPoint;
import se.artisan_be.util.RowValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Formatters shared by the chart registry. Rows carry the aliases {@code label}, {@code stack},
 * {@code total}, {@code average}, {@code reg_year} and {@code reg_month}.
 */
public final class ChartFormatters {

    public static final String UNKNOWN = "Unknown";

    private ChartFormatters() {
    }

    public static ChartFormatter simpleDistribution() {
        return rows -> {
            List<ChartPoint> points = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                points.add(new ChartPoint(label(row.get("label")), RowValues.numberOrZero(row, "total")));
            }
            return points;
        };
    }

    public static ChartFormatter yesNoDistribution() {
        return rows -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (Map<String, Object> row : rows) {
                Boolean flag = RowValues.asBoolean(row, "label");
                String name = flag == null ? UNKNOWN : (flag ? "Yes" : "No");
                counts.merge(name, RowValues.numberOrZero(row, "total").longValue(), Long::sum);
            }
            List<ChartPoint> points = new ArrayList<>(counts.size());
            counts.forEach((name, count) -> points.add(new ChartPoint(name, count)));
            return points;
        };
    }

    public static ChartFormatter averageIncome() {
        return rows -> {
            List<AverageIncomePoint> points = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                points.add(new AverageIncomePoint(label(row.get("label")), RowValues.numberOrZero(row, "average")));
            }
            return points;
        };
    }

    /**
     * Buckets in declared order, zero-filled, with {@code Unknown} appended only when it has members.
     */
    public static ChartFormatter binned(List<String> buckets) {
        return rows -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            buckets.forEach(bucket -> counts.put(bucket, 0L));
            for (Map<String, Object> row : rows) {
                Object bucket = row.get("label");
                String name = bucket == null ? UNKNOWN : bucket.toString();
                counts.merge(name, RowValues.numberOrZero(row, "total").longValue(), Long::sum);
            }
            List<ChartPoint> points = new ArrayList<>(counts.size());
            counts.forEach((name, count) -> points.add(new ChartPoint(name, count)));
            return points;
        };
    }

    /**
     * Pivots {@code (label, stack, total)} rows into one object per label. Every object carries every
     * stack value seen in the result set, defaulting to zero.
     */
    public static ChartFormatter stacked(String primaryKey) {
        return rows -> {
            Set<String> stackKeys = new LinkedHashSet<>();
            for (Map<String, Object> row : rows) {
                Object stack = row.get("stack");
                if (stack != null) {
                    stackKeys.add(stack.toString());
                }
            }

            Map<String, Map<String, Object>> pivot = new LinkedHashMap<>();
            for (Map<String, Object> row : rows) {
                Object primary = row.get("label");
                if (primary == null) {
                    continue;
                }
                Map<String, Object> entry = pivot.computeIfAbsent(primary.toString(), key -> {
                    Map<String, Object> created = new LinkedHashMap<>();
                    created.put(primaryKey, key);
                    stackKeys.forEach(stackKey -> created.put(stackKey, 0L));
                    return created;
                });
                Object stack = row.get("stack");
                if (stack != null) {
                    entry.put(stack.toString(), RowValues.numberOrZero(row, "total").longValue());
                }
            }
            return new ArrayList<>(pivot.values());
        };
    }

    public static ChartFormatter monthlySeries() {
        return ChartFormatters::toMonthlyCounts;
    }

    public static ChartFormatter cumulativeSeries() {
        return rows -> {
            List<MonthlyCount> series = toMonthlyCounts(rows);
            long running = 0;
            for (MonthlyCount point : series) {
                running += point.getCount();
                point.setCount(running);
            }
            return series;
        };
    }

    public static ChartFormatter experienceVsIncome() {
        return rows -> {
            List<ScatterPoint> points = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                points.add(new ScatterPoint(RowValues.numberOrZero(row, "experience"),
                        RowValues.numberOrZero(row, "income")));
            }
            return points;
        };
    }

    public static ChartFormatter geographical() {
        return rows -> {
            List<GeoPoint> points = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                points.add(GeoPoint.builder()
                        .latitude(RowValues.numberOrZero(row, "latitude"))
                        .longitude(RowValues.numberOrZero(row, "longitude"))
                        .name(orUnknown(row.get("name")))
                        .fatherName(orUnknown(row.get("father_name")))
                        .build());
            }
            return points;
        };
    }

    /** First letter upper-cased, the rest lower-cased; null or blank becomes {@code Unknown}. */
    public static String titleCase(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String label(Object value) {
        return titleCase(value == null ? null : value.toString());
    }

    private static String orUnknown(Object value) {
        return value == null || value.toString().isBlank() ? UNKNOWN : value.toString();
    }

    private static List<MonthlyCount> toMonthlyCounts(List<Map<String, Object>> rows) {
        List<MonthlyCount> series = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Integer year = RowValues.asInteger(row, "reg_year");
            Integer month = RowValues.asInteger(row, "reg_month");
            if (year == null || month == null) {
                continue;
            }
            series.add(new MonthlyCount(String.format("%04d-%02d", year, month),
                    RowValues.numberOrZero(row, "total").longValue()));
        }
        return series;
    }
}
