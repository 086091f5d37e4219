package com.xammer.anomaly.controller;

import com.xammer.anomaly.dto.AnomalyReportDto;
import com.xammer.anomaly.service.AnomalyAggregator;
import com.xammer.anomaly.service.AnomalyDateWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/anomalies")
public class AnomalyController {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyController.class);

    private final AnomalyAggregator anomalyAggregator;

    public AnomalyController(AnomalyAggregator anomalyAggregator) {
        this.anomalyAggregator = anomalyAggregator;
    }

    /**
     * Example: /api/anomalies/report?startDate=2025-08-01&endDate=2025-10-31
     * Either bound may be omitted and falls back to the default lookback window.
     */
    @GetMapping("/report")
    public ResponseEntity<AnomalyReportDto> getAnomalyReport(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        AnomalyDateWindow defaults = anomalyAggregator.defaultWindow();
        AnomalyDateWindow window = new AnomalyDateWindow(
                startDate != null ? startDate : defaults.getStart(),
                endDate != null ? endDate : defaults.getEnd());

        logger.info("📊 Anomaly report request - Start: {}, End: {}", window.getStart(), window.getEnd());
        AnomalyReportDto report = anomalyAggregator.collect(window);
        logger.info("✅ Anomaly report built: {} anomalies", report.size());
        return ResponseEntity.ok(report);
    }
}
