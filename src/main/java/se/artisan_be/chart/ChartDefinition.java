package se.artisan_be.chart;

import lombok.Builder;
import lombok.Getter;
import se.artisan_be.exception.BadRequestException;

import java.util.Map;

/**
 * One declarative report over {@code artisans_view a}. Charts with {@link #dynamicColumns} take a
 * URL segment naming the grouping column; the resolved column replaces {@value #COLUMN_TOKEN}
 * in {@link #select}, {@link #groupBy} and {@link #orderBy}.
 */
@Getter
@Builder
public class ChartDefinition {

    public static final String COLUMN_TOKEN = "{column}";

    private final String name;
    private final String title;
    private final String select;
    private final String where;
    private final String groupBy;
    private final String orderBy;
    private final Integer limit;
    private final ChartFormatter formatter;
    private final Map<String, String> dynamicColumns;

    public boolean isDynamic() {
        return dynamicColumns != null;
    }

    public String resolveColumn(String segment) {
        if (!isDynamic()) {
            if (segment != null) {
                throw new BadRequestException("Chart '" + name + "' does not accept a grouping");
            }
            return null;
        }
        if (segment == null || !dynamicColumns.containsKey(segment)) {
            throw new BadRequestException("Invalid value '" + segment + "' for chart '" + name
                    + "'. Allowed values: " + String.join(", ", dynamicColumns.keySet()));
        }
        return dynamicColumns.get(segment);
    }

    public String toSql(String column, String filterClause) {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(render(select, column))
                .append(" FROM artisans_view a WHERE a.is_active = TRUE")
                .append(filterClause);
        if (where != null) {
            sql.append(" AND ").append(render(where, column));
        }
        if (groupBy != null) {
            sql.append(" GROUP BY ").append(render(groupBy, column));
        }
        if (orderBy != null) {
            sql.append(" ORDER BY ").append(render(orderBy, column));
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.toString();
    }

    private static String render(String template, String column) {
        return column == null ? template : template.replace(COLUMN_TOKEN, column);
    }
}
