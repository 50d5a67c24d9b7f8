package se.artisan_be.chart;

import java.util.List;
import java.util.Map;

/**
 * Shapes raw result rows into the payload a chart widget consumes.
 */
@FunctionalInterface
public interface ChartFormatter {

    Object format(List<Map<String, Object>> rows);
}
