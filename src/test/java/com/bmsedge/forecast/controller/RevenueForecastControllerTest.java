package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.exception.GlobalExceptionHandler;
import com.bmsedge.forecast.exception.InsufficientDataException;
import com.bmsedge.forecast.model.ForecastOverrides;
import com.bmsedge.forecast.model.HistoricalRevenueInput;
import com.bmsedge.forecast.service.ForecastAccuracyService;
import com.bmsedge.forecast.service.RevenueForecastingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for RevenueForecastController with the global exception handler
 */
class RevenueForecastControllerTest {

    @Mock
    private RevenueForecastingService forecastingService;

    @Mock
    private ForecastAccuracyService accuracyService;

    @InjectMocks
    private RevenueForecastController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should map request body and options onto the forecasting service")
    void testForecastDelegates() throws Exception {
        // Arrange
        when(forecastingService.forecast(any(HistoricalRevenueInput.class), any(ForecastOverrides.class)))
                .thenThrow(new InsufficientDataException(6, 2));

        String body = "{\"clinicId\":\"clinic-1\",\"granularity\":\"WEEKLY\",\"currency\":\"USD\","
                + "\"dataPoints\":[{\"date\":\"2025-01-06\",\"revenue\":1200},{\"date\":\"2025-01-13\",\"revenue\":1350}],"
                + "\"options\":{\"method\":\"linear_regression\",\"forecastPeriods\":4}}";

        // Act
        mockMvc.perform(post("/api/forecasts").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_DATA"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value(400));

        // Assert
        ArgumentCaptor<HistoricalRevenueInput> input = ArgumentCaptor.forClass(HistoricalRevenueInput.class);
        ArgumentCaptor<ForecastOverrides> overrides = ArgumentCaptor.forClass(ForecastOverrides.class);
        verify(forecastingService).forecast(input.capture(), overrides.capture());
        assertEquals("clinic-1", input.getValue().getClinicId());
        assertEquals("USD", input.getValue().getCurrency());
        assertEquals(2, input.getValue().getDataPoints().size());
        assertEquals("linear_regression", overrides.getValue().getMethod());
        assertEquals(4, overrides.getValue().getForecastPeriods());
        assertNull(overrides.getValue().getConfidenceLevel());
    }

    @Test
    @DisplayName("Should reject a request without a clinic id or data points")
    void testValidationErrors() throws Exception {
        mockMvc.perform(post("/api/forecasts").contentType(MediaType.APPLICATION_JSON).content("{\"dataPoints\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.validationErrors").isArray());

        verifyNoInteractions(forecastingService);
    }

    @Test
    @DisplayName("Should reject negative revenue in the request body")
    void testNegativeRevenueValidation() throws Exception {
        String body = "{\"clinicId\":\"clinic-1\",\"dataPoints\":[{\"date\":\"2025-01-01\",\"revenue\":-5}]}";

        mockMvc.perform(post("/api/forecasts").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(forecastingService);
    }

    @Test
    @DisplayName("Should list registered methods plus ensemble")
    void testMethods() throws Exception {
        when(forecastingService.getAvailableStrategies()).thenReturn(List.of("arima", "moving_average"));
        when(forecastingService.getModelVersion()).thenReturn("2.0.0");

        mockMvc.perform(get("/api/forecasts/methods"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.methods[0]").value("arima"))
                .andExpect(jsonPath("$.methods[2]").value("ensemble"))
                .andExpect(jsonPath("$.modelVersion").value("2.0.0"));
    }

    @Test
    @DisplayName("Should hide unexpected failures behind a generic 500 response")
    void testUnexpectedError() throws Exception {
        when(forecastingService.getAvailableStrategies()).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/forecasts/methods"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal Server Error"));
    }
}
