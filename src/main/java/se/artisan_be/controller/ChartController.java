package se.artisan_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.artisan_be.dto.response.ObjectResponse;
import se.artisan_be.service.ChartService;

import java.util.Map;

@RestController
@RequestMapping("/charts")
@Tag(name = "Charts", description = "Aggregated artisan statistics for the dashboard")
@AllArgsConstructor
public class ChartController {
    private final ChartService chartService;

    @GetMapping("/dashboard")
    @Operation(summary = "Dashboard cards", description = "Active artisans, regions covered and registrations this month")
    public ResponseEntity<?> getDashboard(@RequestParam Map<String, String> filters) {
        return ok("Successfully retrieved dashboard", chartService.getDashboard(filters));
    }

    @GetMapping("/all")
    @Operation(summary = "All charts", description = "Every chart in one response, keyed by report name")
    public ResponseEntity<?> getAllCharts(@RequestParam Map<String, String> filters) {
        return ok("Successfully retrieved charts", chartService.getAllCharts(filters));
    }

    @GetMapping("/{chartName}")
    @Operation(summary = "Get chart", description = "Filters such as gender, tehsil, skill or avg_monthly_income=10000-20000 narrow the data")
    public ResponseEntity<?> getChart(@PathVariable String chartName,
                                      @RequestParam Map<String, String> filters) {
        return ok("Successfully retrieved chart", chartService.getChart(chartName, null, filters));
    }

    @GetMapping("/{chartName}/{groupBy}")
    @Operation(summary = "Get grouped chart", description = "yes-no/{field} or distribution charts grouped by skill, craft or category")
    public ResponseEntity<?> getGroupedChart(@PathVariable String chartName,
                                             @PathVariable String groupBy,
                                             @RequestParam Map<String, String> filters) {
        return ok("Successfully retrieved chart", chartService.getChart(chartName, groupBy, filters));
    }

    private static ResponseEntity<?> ok(String message, Object data) {
        return ResponseEntity.status(HttpStatus.OK).body(
                ObjectResponse.builder()
                        .status(HttpStatus.OK.toString())
                        .message(message)
                        .data(data)
                        .build()
        );
    }
}
