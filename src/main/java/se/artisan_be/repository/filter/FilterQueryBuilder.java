package se.artisan_be.repository.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Appends {@code AND ...} predicates for whitelisted request filters. Values are always bound
 * as positional parameters of the column's type; malformed values are ignored rather than rejected.
 */
public final class FilterQueryBuilder {

    /** Placeholder the dashboard sends for an untouched drop-down. */
    public static final String PLACEHOLDER = "Select";

    private FilterQueryBuilder() {
    }

    public static void applyFilters(StringBuilder sql, List<Object> params, String alias,
                                    Map<String, String> requestParams) {
        if (requestParams == null || requestParams.isEmpty()) {
            return;
        }
        for (ArtisanFilter filter : ArtisanFilter.values()) {
            String raw = requestParams.get(filter.getParameter());
            if (raw != null) {
                applyFilter(sql, params, alias + "." + filter.getColumn(), raw, filter.getKind());
            }
        }
    }

    public static void applyFilter(StringBuilder sql, List<Object> params, String column,
                                   String rawValue, FilterKind kind) {
        if (rawValue == null || rawValue.isBlank()) {
            return;
        }
        String target = column.toLowerCase(Locale.ROOT);
        if (kind == FilterKind.NUMERICAL) {
            applyNumerical(sql, params, target, rawValue.trim());
        } else {
            applyCategorical(sql, params, target, rawValue, kind);
        }
    }

    private static void applyCategorical(StringBuilder sql, List<Object> params, String column,
                                         String rawValue, FilterKind kind) {
        List<Object> values = new ArrayList<>();
        for (String token : rawValue.split(",")) {
            String value = token.trim();
            if (value.isEmpty() || PLACEHOLDER.equalsIgnoreCase(value)) {
                continue;
            }
            Object converted = convert(value, kind);
            if (converted != null) {
                values.add(converted);
            }
        }
        if (values.isEmpty()) {
            return;
        }
        if (values.size() == 1) {
            sql.append(" AND ").append(column).append(" = ?");
        } else {
            sql.append(" AND ").append(column).append(" IN (")
                    .append(String.join(", ", Collections.nCopies(values.size(), "?")))
                    .append(")");
        }
        params.addAll(values);
    }

    private static void applyNumerical(StringBuilder sql, List<Object> params, String column, String value) {
        int dash = value.indexOf('-');
        if (dash >= 0) {
            Double min = parse(value.substring(0, dash));
            Double max = parse(value.substring(dash + 1));
            if (min != null && max != null) {
                sql.append(" AND ").append(column).append(" BETWEEN ? AND ?");
                params.addAll(Arrays.asList(min, max));
            } else if (min != null) {
                sql.append(" AND ").append(column).append(" >= ?");
                params.add(min);
            } else if (max != null) {
                sql.append(" AND ").append(column).append(" <= ?");
                params.add(max);
            }
            return;
        }
        if (value.startsWith(">") || value.startsWith("<")) {
            Double bound = parse(value.substring(1));
            if (bound != null) {
                sql.append(" AND ").append(column).append(' ').append(value.charAt(0)).append(" ?");
                params.add(bound);
            }
            return;
        }
        Double exact = parse(value);
        if (exact != null) {
            sql.append(" AND ").append(column).append(" = ?");
            params.add(exact);
        }
    }

    private static Object convert(String value, FilterKind kind) {
        return switch (kind) {
            case IDENTIFIER -> parseId(value);
            case FLAG -> switch (value.toLowerCase(Locale.ROOT)) {
                case "true", "yes", "1" -> Boolean.TRUE;
                case "false", "no", "0" -> Boolean.FALSE;
                default -> null;
            };
            default -> value;
        };
    }

    private static Long parseId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parse(String token) {
        String trimmed = token.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
