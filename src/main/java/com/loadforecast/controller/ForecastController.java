package com.loadforecast.controller;

import com.loadforecast.config.RequestGuardFilter;
import com.loadforecast.dto.ForecastRequest;
import com.loadforecast.dto.ForecastResponse;
import com.loadforecast.dto.ModelVersionResponse;
import com.loadforecast.service.ForecastService;
import com.loadforecast.service.InMemoryModelRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastService forecastService;
    private final InMemoryModelRegistry modelRegistry;

    @PostMapping("/forecasts")
    public ResponseEntity<ForecastResponse> forecast(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts | pid={} | measurements={} | requestId={}",
                 request.getJob().getId(), request.getMeasurements().size(), requestId);
        ForecastResponse response = forecastService.forecast(request, requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(response);
    }

    @GetMapping("/models/{experimentName}")
    public ResponseEntity<ModelVersionResponse> latestModel(@PathVariable String experimentName) {
        return ResponseEntity.ok(modelRegistry.describe(experimentName));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = RequestGuardFilter.requestId(request);
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
