package se.artisan_be.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import se.artisan_be.dto.response.ChartPoint;
import se.artisan_be.dto.response.DashboardResponse;
import se.artisan_be.exception.BadRequestException;
import se.artisan_be.exception.GlobalExceptionHandler;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.service.ChartService;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChartControllerTest {

    @Mock
    private ChartService chartService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChartController(chartService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getChart_wrapsPointsInEnvelopeAndPassesFilters() throws Exception {
        when(chartService.getChart("gender", null, Map.of("tehsil", "Model Town")))
                .thenReturn(List.of(new ChartPoint("Female", 2L)));

        mockMvc.perform(get("/charts/gender").param("tehsil", "Model Town"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("200 OK"))
                .andExpect(jsonPath("$.data[0].name").value("Female"))
                .andExpect(jsonPath("$.data[0].value").value(2));
    }

    @Test
    void getGroupedChart_passesGrouping() throws Exception {
        when(chartService.getChart(eq("yes-no"), eq("has_training"), anyMap())).thenReturn(List.of());

        mockMvc.perform(get("/charts/yes-no/has_training"))
                .andExpect(status().isOk());

        verify(chartService).getChart("yes-no", "has_training", Map.of());
    }

    @Test
    void unknownChart_isNotFound() throws Exception {
        when(chartService.getChart(eq("nope"), isNull(), anyMap()))
                .thenThrow(new ResourceNotFoundException("Chart 'nope' not found"));

        mockMvc.perform(get("/charts/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.statusCode").value(404))
                .andExpect(jsonPath("$.message").value("Chart 'nope' not found"));
    }

    @Test
    void invalidGrouping_isBadRequest() throws Exception {
        when(chartService.getChart(eq("yes-no"), eq("name"), anyMap()))
                .thenThrow(new BadRequestException("Invalid field for yes-no chart: name"));

        mockMvc.perform(get("/charts/yes-no/name"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.statusCode").value(400));
    }

    @Test
    void dashboard_returnsCounts() throws Exception {
        when(chartService.getDashboard(anyMap())).thenReturn(new DashboardResponse(12, 4, 3));

        mockMvc.perform(get("/charts/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalActiveArtisans").value(12))
                .andExpect(jsonPath("$.data.regionsCovered").value(4))
                .andExpect(jsonPath("$.data.newRegistrationsThisMonth").value(3));
    }
}
