package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.dto.BatchForecastRequest;
import com.bmsedge.forecast.dto.ForecastAccuracyRequest;
import com.bmsedge.forecast.dto.ForecastRequest;
import com.bmsedge.forecast.model.BatchForecastResult;
import com.bmsedge.forecast.model.ForecastAccuracyResult;
import com.bmsedge.forecast.model.RevenueForecastOutput;
import com.bmsedge.forecast.service.ForecastAccuracyService;
import com.bmsedge.forecast.service.RevenueForecastingService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/forecasts")
@CrossOrigin(origins = "*")
public class RevenueForecastController {

    @Autowired
    private RevenueForecastingService forecastingService;

    @Autowired
    private ForecastAccuracyService accuracyService;

    // ============= FORECAST ENDPOINTS =============

    /**
     * Forecast revenue for a single clinic
     */
    @PostMapping
    public ResponseEntity<RevenueForecastOutput> forecast(@Valid @RequestBody ForecastRequest request) {
        return ResponseEntity.ok(forecastingService.forecast(request.toInput(), request.toOverrides()));
    }

    /**
     * Forecast revenue for several clinics with shared options
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchForecastResult> forecastBatch(@Valid @RequestBody BatchForecastRequest request) {
        BatchForecastResult result = forecastingService.forecastBatch(
                request.toInputs(), request.toOverrides(), request.isContinueOnError());
        return ResponseEntity.ok(result);
    }

    // ============= ACCURACY ENDPOINTS =============

    /**
     * Compare a past forecast with the actual revenue
     */
    @PostMapping("/accuracy")
    public ResponseEntity<ForecastAccuracyResult> compareAccuracy(@Valid @RequestBody ForecastAccuracyRequest request) {
        return ResponseEntity.ok(accuracyService.compare(request));
    }

    // ============= METADATA =============

    @GetMapping("/methods")
    public ResponseEntity<Map<String, Object>> getMethods() {
        List<String> methods = new ArrayList<>(forecastingService.getAvailableStrategies());
        methods.add(RevenueForecastingService.ENSEMBLE);

        Map<String, Object> response = new HashMap<>();
        response.put("methods", methods);
        response.put("modelVersion", forecastingService.getModelVersion());
        return ResponseEntity.ok(response);
    }
}
